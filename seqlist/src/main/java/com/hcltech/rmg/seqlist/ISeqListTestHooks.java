package com.hcltech.rmg.seqlist;

/** Internal state exposed for tests only. */
public interface ISeqListTestHooks {
    int _capacityForTest();

    boolean _isDestroyedForTest();
}
