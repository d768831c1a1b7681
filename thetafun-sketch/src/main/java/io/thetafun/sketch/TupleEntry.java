package io.thetafun.sketch;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;

/**
 * A retained hash of a tuple sketch together with its summary.
 */
public final class TupleEntry<S>
{
  private final long hash;
  private final S summary;

  private TupleEntry(long hash, S summary)
  {
    this.hash = hash;
    this.summary = summary;
  }

  public static <S> TupleEntry<S> of(long hash, S summary)
  {
    return new TupleEntry<>(hash, summary);
  }

  public long getHash()
  {
    return hash;
  }

  public S getSummary()
  {
    return summary;
  }

  @Override
  public boolean equals(Object o)
  {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TupleEntry)) {
      return false;
    }
    TupleEntry<?> that = (TupleEntry<?>) o;
    return hash == that.hash && Objects.equal(summary, that.summary);
  }

  @Override
  public int hashCode()
  {
    return Objects.hashCode(hash, summary);
  }

  @Override
  public String toString()
  {
    return MoreObjects.toStringHelper(this)
                      .add("hash", hash)
                      .add("summary", summary)
                      .toString();
  }
}
