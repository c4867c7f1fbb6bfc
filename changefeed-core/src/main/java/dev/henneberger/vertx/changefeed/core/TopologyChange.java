package dev.henneberger.vertx.changefeed.core;

import java.util.Objects;

public final class TopologyChange {

  public enum Role {
    PRIMARY,
    SECONDARY,
    UNKNOWN,
    OTHER
  }

  private final String address;
  private final Role previousRole;
  private final Role newRole;

  public TopologyChange(String address, Role previousRole, Role newRole) {
    this.address = Objects.requireNonNull(address, "address");
    this.previousRole = previousRole == null ? Role.UNKNOWN : previousRole;
    this.newRole = Objects.requireNonNull(newRole, "newRole");
  }

  public String address() {
    return address;
  }

  public Role previousRole() {
    return previousRole;
  }

  public Role newRole() {
    return newRole;
  }

  public boolean isPrimaryElected() {
    return newRole == Role.PRIMARY && previousRole != Role.PRIMARY;
  }

  @Override
  public String toString() {
    return "TopologyChange{address=" + address + ", " + previousRole + " -> " + newRole + '}';
  }
}
