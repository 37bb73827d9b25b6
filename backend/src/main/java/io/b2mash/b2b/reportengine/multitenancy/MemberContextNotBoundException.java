package io.b2mash.b2b.reportengine.multitenancy;

public class MemberContextNotBoundException extends RuntimeException {

  public MemberContextNotBoundException() {
    super("Member context not available: member id not bound by filter chain");
  }
}
