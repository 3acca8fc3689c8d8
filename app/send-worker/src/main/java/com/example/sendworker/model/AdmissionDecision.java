package com.example.sendworker.model;

public enum AdmissionDecision {
  ADMIT,
  DEFER
}
