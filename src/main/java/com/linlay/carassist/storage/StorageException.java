package com.linlay.carassist.storage;

public class StorageException extends RuntimeException {

    public enum Category {
        UNAVAILABLE,
        INTEGRITY_VIOLATION,
        UNIQUE_VIOLATION,
        TRANSACTION_FAILED
    }

    private final Category category;

    public StorageException(Category category, String message, Throwable cause) {
        super(message, cause);
        this.category = category;
    }

    public Category category() {
        return category;
    }
}
