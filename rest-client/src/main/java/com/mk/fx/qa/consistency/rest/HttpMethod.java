package com.mk.fx.qa.consistency.rest;

public enum HttpMethod {
  GET,
  POST,
  PUT,
  PATCH,
  DELETE
}
