package com.linlay.carassist.session;

public class StorageNotConfiguredException extends RuntimeException {

    public StorageNotConfiguredException() {
        super("DATABASE_URL environment variable is required. Please configure the database.");
    }
}
