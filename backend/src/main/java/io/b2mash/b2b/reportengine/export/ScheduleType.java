package io.b2mash.b2b.reportengine.export;

public enum ScheduleType {
  DAILY,
  WEEKLY,
  MONTHLY
}
