/*
 * どこで: app/healthion-api/src/main/java/com/healthion/bff/api/response/PageResponse.java
 * 何を: upstream のページング結果 (イベント/サマリー) を整形済みの要素で返す DTO
 */
package com.healthion.bff.api.response;

import java.util.List;

public record PageResponse<T>(List<T> data, boolean hasMore, String nextCursor) {

  public PageResponse {
    data = data == null ? List.of() : List.copyOf(data);
  }

  public static <T> PageResponse<T> empty() {
    return new PageResponse<>(List.of(), false, null);
  }
}
