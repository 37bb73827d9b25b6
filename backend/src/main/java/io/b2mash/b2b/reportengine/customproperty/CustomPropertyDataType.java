package io.b2mash.b2b.reportengine.customproperty;

/** Supported data types for tenant-defined custom properties. */
public enum CustomPropertyDataType {
  TEXT,
  NUMBER,
  DATE,
  DATETIME,
  SELECT,
  MULTI_SELECT,
  BOOLEAN,
  URL,
  EMAIL,
  PHONE
}
