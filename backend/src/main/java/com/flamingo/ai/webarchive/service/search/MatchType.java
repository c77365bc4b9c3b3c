package com.flamingo.ai.webarchive.service.search;

/** Which retriever ranked a hit best. */
public enum MatchType {
  LEXICAL,
  SEMANTIC
}
