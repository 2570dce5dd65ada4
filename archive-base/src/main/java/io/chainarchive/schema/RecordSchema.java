package io.chainarchive.schema;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * The ordered physical layout of one record kind. Built once per kind and never mutated, the column
 * order here is the column order of every file written for that kind.
 */
public class RecordSchema {
  private final String name;
  private final ImmutableList<FieldDescriptor> fields;

  public RecordSchema(String name, List<FieldDescriptor> fields) {
    Preconditions.checkArgument(fields != null && !fields.isEmpty(), "Schema %s has no fields", name);
    Set<String> names = new HashSet<>();
    for (FieldDescriptor field : fields) {
      if (!names.add(field.getName()))
        throw new IllegalArgumentException("Duplicate field " + field.getName() + " in schema " + name);
    }
    this.name = name;
    this.fields = ImmutableList.copyOf(fields);
  }

  public static Builder builder(String name) {
    return new Builder(name);
  }

  public String getName() {
    return name;
  }

  public List<FieldDescriptor> getFields() {
    return fields;
  }

  public int numFields() {
    return fields.size();
  }

  public FieldDescriptor field(int index) {
    return fields.get(index);
  }

  public int indexOf(String fieldName) {
    for (int i = 0; i < fields.size(); i++) {
      if (fields.get(i).getName().equals(fieldName))
        return i;
    }
    return -1;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    RecordSchema that = (RecordSchema) o;
    return name.equals(that.name) && fields.equals(that.fields);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, fields);
  }

  @Override
  public String toString() {
    return "RecordSchema{" + name + ", " + fields + '}';
  }

  public static class Builder {
    private final String name;
    private final ImmutableList.Builder<FieldDescriptor> fields = ImmutableList.builder();

    private Builder(String name) {
      this.name = name;
    }

    public Builder required(String field, PhysicalType type) {
      fields.add(FieldDescriptor.required(field, type));
      return this;
    }

    public Builder required(String field, PhysicalType type, LogicalType logicalType) {
      fields.add(FieldDescriptor.required(field, type, logicalType));
      return this;
    }

    public Builder optional(String field, PhysicalType type) {
      fields.add(FieldDescriptor.optional(field, type));
      return this;
    }

    public Builder optional(String field, PhysicalType type, LogicalType logicalType) {
      fields.add(FieldDescriptor.optional(field, type, logicalType));
      return this;
    }

    public RecordSchema build() {
      return new RecordSchema(name, fields.build());
    }
  }
}
