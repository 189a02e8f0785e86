package com.apptrace.service.storage.bulk;

import java.util.List;

/** One attempt at storing a whole batch. */
@FunctionalInterface
public interface BatchWriter<R> {

    void write(List<R> records) throws Exception;
}
