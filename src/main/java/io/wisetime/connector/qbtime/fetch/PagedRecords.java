/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.connector.qbtime.fetch;

import com.google.common.collect.AbstractIterator;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Streams;
import io.wisetime.connector.qbtime.model.ApiPage;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Stream;

/**
 * All records of a list endpoint, fetched lazily one page at a time. Every call to {@link #iterator()} starts again
 * from the first page; stopping early leaves the remaining pages unrequested.
 */
public class PagedRecords<T> implements Iterable<T> {

  private final RateLimitedFetcher fetcher;
  private final EndpointSpec<T> endpoint;
  private final ImmutableMap<String, String> filters;
  private final int pageSize;

  PagedRecords(RateLimitedFetcher fetcher, EndpointSpec<T> endpoint, ImmutableMap<String, String> filters,
               int pageSize) {
    this.fetcher = fetcher;
    this.endpoint = endpoint;
    this.filters = filters;
    this.pageSize = pageSize;
  }

  @Override
  public Iterator<T> iterator() {
    return new PageIterator();
  }

  public Stream<T> stream() {
    return Streams.stream(this);
  }

  /**
   * Fetches every remaining page.
   */
  public List<T> toList() {
    return ImmutableList.copyOf(this);
  }

  public EndpointSpec<T> getEndpoint() {
    return endpoint;
  }

  private class PageIterator extends AbstractIterator<T> {

    private Iterator<T> current = Collections.emptyIterator();
    private int nextPage = 1;
    private boolean more = true;

    @Override
    protected T computeNext() {
      while (!current.hasNext()) {
        if (!more) {
          return endOfData();
        }
        final ApiPage<T> page = fetcher.fetchPage(endpoint, filters, nextPage, pageSize);
        nextPage++;
        // an empty page ends the traversal even if the service claims there is more
        more = page.isMore() && !page.getRecords().isEmpty();
        current = page.getRecords().iterator();
      }
      return current.next();
    }
  }
}
