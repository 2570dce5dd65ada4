package io.chainarchive.schema;

import java.util.Objects;

import com.google.common.base.Preconditions;

public class FieldDescriptor {
  private final String name;
  private final PhysicalType physicalType;
  private final LogicalType logicalType;
  private final boolean optional;

  public FieldDescriptor(String name, PhysicalType physicalType, LogicalType logicalType, boolean optional) {
    Preconditions.checkArgument(name != null && !name.isEmpty(), "A field must have a name");
    this.name = name;
    this.physicalType = Preconditions.checkNotNull(physicalType, "physicalType");
    this.logicalType = logicalType == null ? LogicalType.NONE : logicalType;
    this.optional = optional;
  }

  public static FieldDescriptor required(String name, PhysicalType physicalType) {
    return new FieldDescriptor(name, physicalType, LogicalType.NONE, false);
  }

  public static FieldDescriptor required(String name, PhysicalType physicalType, LogicalType logicalType) {
    return new FieldDescriptor(name, physicalType, logicalType, false);
  }

  public static FieldDescriptor optional(String name, PhysicalType physicalType) {
    return new FieldDescriptor(name, physicalType, LogicalType.NONE, true);
  }

  public static FieldDescriptor optional(String name, PhysicalType physicalType, LogicalType logicalType) {
    return new FieldDescriptor(name, physicalType, logicalType, true);
  }

  public String getName() {
    return name;
  }

  public PhysicalType getPhysicalType() {
    return physicalType;
  }

  public LogicalType getLogicalType() {
    return logicalType;
  }

  public boolean isOptional() {
    return optional;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    FieldDescriptor that = (FieldDescriptor) o;
    return optional == that.optional && name.equals(that.name) && physicalType == that.physicalType && logicalType == that.logicalType;
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, physicalType, logicalType, optional);
  }

  @Override
  public String toString() {
    return (optional ? "OPTIONAL " : "REQUIRED ") + physicalType + " " + name + (logicalType == LogicalType.NONE ? "" : " (" + logicalType + ")");
  }
}
