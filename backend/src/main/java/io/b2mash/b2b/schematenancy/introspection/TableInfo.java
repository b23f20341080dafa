package io.b2mash.b2b.schematenancy.introspection;

public record TableInfo(String name, TableType type) {

  public enum TableType {
    TABLE,
    VIEW
  }
}
