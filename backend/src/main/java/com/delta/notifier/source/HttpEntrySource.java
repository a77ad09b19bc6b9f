package com.delta.notifier.source;

import com.delta.notifier.config.NotifierProperties;
import com.delta.notifier.http.ListingHttpClient;
import com.delta.notifier.model.Entry;
import com.delta.notifier.model.HttpFetchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class HttpEntrySource implements EntrySource {
    private static final Logger log = LoggerFactory.getLogger(HttpEntrySource.class);
    private static final String ACCEPT = "text/markdown,text/plain,text/html;q=0.9,*/*;q=0.8";

    private final NotifierProperties properties;
    private final ListingHttpClient httpClient;
    private final ListingTableParser parser;

    public HttpEntrySource(NotifierProperties properties, ListingHttpClient httpClient, ListingTableParser parser) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.parser = parser;
    }

    @Override
    public List<Entry> fetchEntries() throws EntryFetchException {
        String url = properties.getSource().getUrl();
        if (url == null || url.isBlank()) {
            throw new EntryFetchException(EntryFetchException.Kind.NETWORK, "listing source URL is blank");
        }
        HttpFetchResult fetch = httpClient.get(url, ACCEPT);
        if (!fetch.isSuccessful()) {
            String status = fetch.errorCode() == null ? "http_" + fetch.statusCode() : fetch.errorCode();
            throw new EntryFetchException(
                EntryFetchException.Kind.NETWORK,
                "failed to fetch listing document " + url + ": " + status
            );
        }
        List<Entry> entries = parser.parse(fetch.body(), url);
        log.debug("Fetched {} listing entries from {} in {} ms", entries.size(), url, fetch.duration().toMillis());
        return entries;
    }
}
