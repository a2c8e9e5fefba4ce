package com.example.driftalert.common.report;

import java.nio.file.Path;

public class DriftReportNotFoundException extends RuntimeException {

  public DriftReportNotFoundException(Path path) {
    super("drift report not found: " + path);
  }
}
