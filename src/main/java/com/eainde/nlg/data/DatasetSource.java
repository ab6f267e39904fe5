package com.eainde.nlg.data;

import java.util.List;
import java.util.function.Predicate;

/**
 * Read-only table of statistics for one dataset.
 */
public interface DatasetSource {

    String name();

    List<DataRow> query(Predicate<DataRow> predicate);

    List<DataRow> all();
}
