package io.b2mash.b2b.reportengine.report.field;

import java.util.List;

public record FieldValidationResult(boolean valid, List<String> invalidFields) {

  public static FieldValidationResult of(List<String> invalidFields) {
    return new FieldValidationResult(invalidFields.isEmpty(), List.copyOf(invalidFields));
  }
}
