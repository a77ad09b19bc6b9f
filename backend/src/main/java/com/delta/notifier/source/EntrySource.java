package com.delta.notifier.source;

import com.delta.notifier.model.Entry;

import java.util.List;

/**
 * Produces the full current listing, in document order. Malformed rows are skipped and
 * no returned entry lacks an organization.
 */
public interface EntrySource {
    List<Entry> fetchEntries() throws EntryFetchException;
}
