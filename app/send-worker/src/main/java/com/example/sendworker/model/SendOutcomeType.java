package com.example.sendworker.model;

public enum SendOutcomeType {
  SUCCEEDED,
  THROTTLED,
  FAILED
}
