package io.thetafun.sketch;

/**
 * Supplies the slot arrays of sketch and union tables. Arrays must come back zero-filled.
 */
public interface EntryAllocator
{
  EntryAllocator HEAP = new EntryAllocator()
  {
    @Override
    public long[] allocateHashes(int size)
    {
      return new long[size];
    }

    @Override
    public Object[] allocateSummaries(int size)
    {
      return new Object[size];
    }
  };

  long[] allocateHashes(int size);

  Object[] allocateSummaries(int size);
}
