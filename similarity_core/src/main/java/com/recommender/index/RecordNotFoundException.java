package com.recommender.index;

public class RecordNotFoundException extends RuntimeException {

    private final int recordId;

    public RecordNotFoundException(int recordId) {
        super("record not in index: " + recordId);
        this.recordId = recordId;
    }

    public int recordId() {
        return recordId;
    }
}
