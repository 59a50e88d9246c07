package com.linlay.carassist.storage;

@FunctionalInterface
public interface StorageWork<T> {

    T run(StorageSession session);
}
