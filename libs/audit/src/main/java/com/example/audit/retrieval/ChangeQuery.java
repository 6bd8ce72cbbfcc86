/*
 * どこで: 監査履歴の照会
 * 何を: リソース/フィールド/操作者/期間/ページングの絞り込み条件を保持する
 * なぜ: 照会条件を検証済みの不変値として扱うため
 */
package com.example.audit.retrieval;

import com.example.audit.diff.ResourceIds;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Filters for {@link ChangeRetriever#query}. At least one resource id is required; every other
 * filter is optional and all filters are combined with AND. The time range is inclusive at both
 * ends.
 */
public final class ChangeQuery {

  private final List<String> resourceIds;
  private final List<String> fieldNames;
  private final List<String> userIds;
  private final Instant from;
  private final Instant to;
  private final Integer limit;
  private final Integer offset;
  private final SortDirection direction;

  private ChangeQuery(Builder builder) {
    this.resourceIds = List.copyOf(builder.resourceIds);
    this.fieldNames = List.copyOf(builder.fieldNames);
    this.userIds = List.copyOf(builder.userIds);
    this.from = builder.from;
    this.to = builder.to;
    this.limit = builder.limit;
    this.offset = builder.offset;
    this.direction = builder.direction;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static Builder forResources(Object... resourceIds) {
    return new Builder().resourceIds(Arrays.asList(resourceIds));
  }

  public List<String> resourceIds() {
    return resourceIds;
  }

  public List<String> fieldNames() {
    return fieldNames;
  }

  public List<String> userIds() {
    return userIds;
  }

  public Instant from() {
    return from;
  }

  public Instant to() {
    return to;
  }

  public Integer limit() {
    return limit;
  }

  public Integer offset() {
    return offset;
  }

  public SortDirection direction() {
    return direction;
  }

  public static final class Builder {

    private final List<String> resourceIds = new ArrayList<>();
    private final List<String> fieldNames = new ArrayList<>();
    private final List<String> userIds = new ArrayList<>();
    private Instant from;
    private Instant to;
    private Integer limit;
    private Integer offset;
    private SortDirection direction = SortDirection.ASC;

    private Builder() {}

    /** Accepts strings, integral numbers and UUIDs. */
    public Builder resourceId(Object resourceId) {
      resourceIds.add(
          ResourceIds.normalize(resourceId)
              .orElseThrow(
                  () ->
                      new IllegalArgumentException(
                          "resource id must be a non-blank string, integral number or uuid: "
                              + resourceId)));
      return this;
    }

    public Builder resourceIds(Collection<?> ids) {
      ids.forEach(this::resourceId);
      return this;
    }

    public Builder fieldNames(String... names) {
      return fieldNames(Arrays.asList(names));
    }

    public Builder fieldNames(Collection<String> names) {
      names.forEach(name -> fieldNames.add(Objects.requireNonNull(name, "fieldName")));
      return this;
    }

    public Builder userIds(String... ids) {
      return userIds(Arrays.asList(ids));
    }

    public Builder userIds(Collection<String> ids) {
      ids.forEach(id -> userIds.add(Objects.requireNonNull(id, "userId")));
      return this;
    }

    public Builder from(Instant from) {
      this.from = from;
      return this;
    }

    public Builder to(Instant to) {
      this.to = to;
      return this;
    }

    public Builder between(Instant from, Instant to) {
      return from(from).to(to);
    }

    public Builder limit(int limit) {
      if (limit < 0) {
        throw new IllegalArgumentException("limit must not be negative");
      }
      this.limit = limit;
      return this;
    }

    public Builder offset(int offset) {
      if (offset < 0) {
        throw new IllegalArgumentException("offset must not be negative");
      }
      this.offset = offset;
      return this;
    }

    public Builder direction(SortDirection direction) {
      this.direction = Objects.requireNonNull(direction, "direction");
      return this;
    }

    public ChangeQuery build() {
      if (resourceIds.isEmpty()) {
        throw new IllegalArgumentException("at least one resource id is required");
      }
      if (from != null && to != null && from.isAfter(to)) {
        throw new IllegalArgumentException("from must not be after to");
      }
      return new ChangeQuery(this);
    }
  }
}
