/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.connector.qbtime.report;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSetMultimap;
import io.wisetime.connector.qbtime.model.JobCode;
import io.wisetime.connector.qbtime.model.JobCodeType;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Jobcodes indexed by id, with the hierarchy expressed through {@code parent_id}. Ancestors are found by repeated
 * lookup, so missing parents and cycles in the data end the walk instead of failing it.
 */
public class JobCodeTree {

  private static final Logger log = LoggerFactory.getLogger(JobCodeTree.class);

  private final ImmutableMap<Long, JobCode> nodes;
  private final ImmutableSetMultimap<Long, Long> children;

  public JobCodeTree(Collection<JobCode> jobCodes) {
    this.nodes = jobCodes.stream()
        .collect(ImmutableMap.toImmutableMap(JobCode::getId, Function.identity(), (first, second) -> second));
    this.children = jobCodes.stream()
        .collect(ImmutableSetMultimap.toImmutableSetMultimap(JobCode::getParentId, JobCode::getId));
  }

  public static JobCodeTree empty() {
    return new JobCodeTree(ImmutableList.of());
  }

  public Optional<JobCode> get(long id) {
    return Optional.ofNullable(nodes.get(id));
  }

  public Set<Long> ids() {
    return nodes.keySet();
  }

  public Collection<JobCode> all() {
    return nodes.values();
  }

  /**
   * The jobcode followed by its ancestors, ending at the top-level jobcode (or the last one that could be found).
   */
  public ImmutableList<JobCode> ancestry(long id) {
    final ImmutableList.Builder<JobCode> chain = ImmutableList.builder();
    final Set<Long> visited = new HashSet<>();
    JobCode current = nodes.get(id);
    while (current != null && visited.add(current.getId())) {
      chain.add(current);
      if (current.isTopLevel()) {
        break;
      }
      current = nodes.get(current.getParentId());
    }
    if (current != null && !current.isTopLevel() && visited.contains(current.getId())) {
      log.warn("Jobcode hierarchy contains a cycle through jobcode {}", current.getId());
    }
    return chain.build();
  }

  /**
   * The type time on this jobcode is paid as. A jobcode inherits the type of its top-level ancestor; a jobcode below
   * it overrides that type by declaring a type other than regular, the closest such declaration winning. Unknown
   * jobcodes, including 0 for time without a jobcode, are regular.
   */
  public JobCodeType effectiveType(long id) {
    final List<JobCode> chain = ancestry(id);
    return chain.stream()
        .map(JobCode::getType)
        .filter(type -> type != null && type != JobCodeType.REGULAR)
        .findFirst()
        .orElse(JobCodeType.REGULAR);
  }

  /**
   * The top-level ancestor id, or the id itself when the jobcode is unknown.
   */
  public long rootOf(long id) {
    final List<JobCode> chain = ancestry(id);
    return chain.isEmpty() ? id : chain.get(chain.size() - 1).getId();
  }

  /**
   * The jobcode and all of its descendants.
   */
  public Set<Long> subtree(long id) {
    final Set<Long> result = new LinkedHashSet<>();
    final Deque<Long> pending = new ArrayDeque<>();
    pending.add(id);
    while (!pending.isEmpty()) {
      final long next = pending.removeFirst();
      if (result.add(next)) {
        pending.addAll(children.get(next));
      }
    }
    return ImmutableSet.copyOf(result);
  }

  /**
   * Direct children, by name.
   */
  public List<JobCode> childrenOf(long id) {
    return children.get(id).stream()
        .filter(childId -> childId != id)
        .map(nodes::get)
        .filter(Objects::nonNull)
        .sorted(Comparator.comparing(JobCode::getName, Comparator.nullsLast(String.CASE_INSENSITIVE_ORDER)))
        .collect(ImmutableList.toImmutableList());
  }

  /**
   * Jobcode names along the hierarchy, top-level first, e.g. {@code "Acme Corp > Website > Design"}.
   */
  public String path(long id) {
    return ancestry(id).reverse().stream()
        .map(JobCode::getName)
        .collect(Collectors.joining(" > "));
  }

  /**
   * Finds jobcodes by name, case-insensitively. A {@code *} matches any sequence of characters.
   */
  public List<JobCode> findByName(String name) {
    final Pattern pattern = wildcard(name);
    return nodes.values().stream()
        .filter(jobCode -> jobCode.getName() != null && pattern.matcher(jobCode.getName()).matches())
        .collect(ImmutableList.toImmutableList());
  }

  static Pattern wildcard(String name) {
    final String regex = Pattern.compile("\\*").splitAsStream(name.trim())
        .map(part -> part.isEmpty() ? "" : Pattern.quote(part))
        .collect(Collectors.joining(".*"));
    final String suffix = name.trim().endsWith("*") ? ".*" : "";
    return Pattern.compile(regex + suffix, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
  }

  @Override
  public String toString() {
    return String.format(Locale.ROOT, "JobCodeTree[%d jobcodes]", nodes.size());
  }
}
