package com.linlay.carassist.storage;

public interface StorageGateway {

    <T> T execute(String descriptor, StorageWork<T> work) throws StorageException;
}
