package io.github.drompincen.eligibility.runtime.retrieval;

record PolicySection(String docId, String heading, String body) {}
