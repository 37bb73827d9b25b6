package io.b2mash.b2b.reportengine.customproperty;

/** Record kinds that tenants can extend with custom properties. */
public enum CustomPropertyEntityType {
  CASE,
  INVESTIGATION,
  PERSON,
  RIU
}
