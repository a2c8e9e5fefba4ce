/*
 * どこで: Drift 共通レポート入力
 * 何を: drift レポート JSON を DriftEvent へ変換する
 * なぜ: 欠落フィールドの既定値と action 検証を一箇所に集約し、整形側を純粋に保つため
 */
package com.example.driftalert.common.report;

import com.example.driftalert.common.DriftValidationException;
import com.example.driftalert.common.event.ChangeAction;
import com.example.driftalert.common.event.DriftEvent;
import com.example.driftalert.common.event.ResourceChange;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class DriftReportReader {

  private static final Logger logger = LoggerFactory.getLogger(DriftReportReader.class);
  private static final String UNKNOWN = "unknown";
  private static final String DEFAULT_ACTION = ChangeAction.UPDATE.value();

  private final ObjectMapper objectMapper;
  private final Clock clock;

  public DriftReportReader(ObjectMapper objectMapper, Clock clock) {
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  public DriftEvent read(Path reportPath) {
    if (!Files.isRegularFile(reportPath)) {
      throw new DriftReportNotFoundException(reportPath);
    }
    final String json;
    try {
      json = Files.readString(reportPath);
    } catch (NoSuchFileException ex) {
      // isRegularFile 判定後に消えたケース
      throw new DriftReportNotFoundException(reportPath);
    } catch (IOException ex) {
      throw new UncheckedIOException("failed to read drift report: " + reportPath, ex);
    }
    final DriftEvent event = parse(json);
    logger.info(
        "drift report parsed path={} environment={} driftDetected={} totalChanges={}",
        reportPath,
        event.environment(),
        event.driftDetected(),
        event.totalChanges());
    return event;
  }

  public DriftEvent parse(String json) {
    final JsonNode root;
    try {
      root = objectMapper.readTree(json);
    } catch (JsonProcessingException ex) {
      throw new DriftValidationException(
          "invalid drift report", List.of("malformed json: " + ex.getOriginalMessage()));
    }
    if (root == null || !root.isObject()) {
      throw new DriftValidationException(
          "invalid drift report", List.of("report root must be a json object"));
    }
    final List<String> violations = new ArrayList<>();
    final Instant timestamp = parseTimestamp(root.get("timestamp"), violations);
    final List<ResourceChange> changes = parseChanges(root.get("resource_changes"), violations);
    final String environment = text(root, "environment", UNKNOWN, violations);
    final String branch = text(root, "branch", UNKNOWN, violations);
    final String runId = text(root, "workflow_run_id", UNKNOWN, violations);
    final String runUrl = text(root, "workflow_run_url", "", violations);
    final boolean driftDetected = driftDetected(root.get("drift_detected"), changes, violations);
    if (!violations.isEmpty()) {
      throw new DriftValidationException("invalid drift report", violations);
    }
    return new DriftEvent(timestamp, environment, branch, runId, runUrl, driftDetected, changes);
  }

  private Instant parseTimestamp(JsonNode node, List<String> violations) {
    if (isAbsent(node)) {
      return Instant.now(clock);
    }
    if (!node.isTextual()) {
      violations.add("timestamp must be an ISO-8601 string");
      return Instant.now(clock);
    }
    final String value = node.asText();
    try {
      return OffsetDateTime.parse(value).toInstant();
    } catch (DateTimeParseException offsetMissing) {
      try {
        // オフセット無しの日時は UTC とみなす
        return LocalDateTime.parse(value).toInstant(ZoneOffset.UTC);
      } catch (DateTimeParseException ex) {
        violations.add("timestamp is not ISO-8601: " + value);
        return Instant.now(clock);
      }
    }
  }

  private boolean driftDetected(
      JsonNode node, List<ResourceChange> changes, List<String> violations) {
    if (isAbsent(node)) {
      return !changes.isEmpty();
    }
    if (!node.isBoolean()) {
      violations.add("drift_detected must be a boolean");
      return !changes.isEmpty();
    }
    return node.booleanValue();
  }

  private List<ResourceChange> parseChanges(JsonNode node, List<String> violations) {
    if (isAbsent(node)) {
      return List.of();
    }
    if (!node.isArray()) {
      violations.add("resource_changes must be an array");
      return List.of();
    }
    final List<ResourceChange> changes = new ArrayList<>();
    for (int i = 0; i < node.size(); i++) {
      final JsonNode item = node.get(i);
      final String path = "resource_changes[" + i + "]";
      if (!item.isObject()) {
        violations.add(path + " must be an object");
        continue;
      }
      final String actionValue = text(item, "action", DEFAULT_ACTION, violations);
      final ChangeAction action;
      try {
        action = ChangeAction.fromValue(actionValue);
      } catch (IllegalArgumentException ex) {
        violations.add(path + ".action " + ex.getMessage());
        continue;
      }
      changes.add(
          new ResourceChange(
              text(item, "resource_type", UNKNOWN, violations),
              text(item, "resource_name", UNKNOWN, violations),
              action,
              attributes(item.get("before"), path + ".before", violations),
              attributes(item.get("after"), path + ".after", violations)));
    }
    return changes;
  }

  private Map<String, JsonNode> attributes(JsonNode node, String path, List<String> violations) {
    if (isAbsent(node)) {
      return null;
    }
    if (!node.isObject()) {
      violations.add(path + " must be an object");
      return null;
    }
    final Map<String, JsonNode> attributes = new LinkedHashMap<>();
    final Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
    while (fields.hasNext()) {
      final Map.Entry<String, JsonNode> field = fields.next();
      attributes.put(field.getKey(), field.getValue());
    }
    return attributes;
  }

  private String text(JsonNode parent, String field, String defaultValue, List<String> violations) {
    final JsonNode node = parent.get(field);
    if (isAbsent(node)) {
      return defaultValue;
    }
    if (!node.isValueNode()) {
      violations.add(field + " must be a scalar value");
      return defaultValue;
    }
    return node.asText();
  }

  private boolean isAbsent(JsonNode node) {
    return node == null || node.isNull() || node.isMissingNode();
  }
}
