package io.intellixity.activa.persistence.types;

public enum AdapterDirection {
  TO_DATABASE, FROM_DATABASE
}
