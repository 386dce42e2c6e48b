package com.mk.fx.qa.consistency.probe;

import com.mk.fx.qa.consistency.rest.JsonUtil;
import com.mk.fx.qa.consistency.rest.RestResponseData;

/** Decides whether a read response shows the write as fully processed. */
@FunctionalInterface
public interface ConsistencyPredicate {

  boolean isConsistent(RestResponseData readResponse);

  /**
   * Holds when the read returned 200 and the field at the JSON pointer is populated, which signals
   * that the out-of-band worker has finished with the resource.
   */
  static ConsistencyPredicate fieldPopulated(String jsonPointer) {
    return response ->
        response.getStatusCode() == 200
            && response.json().flatMap(json -> JsonUtil.textAt(json, jsonPointer)).isPresent();
  }
}
