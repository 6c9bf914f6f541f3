package io.intellixity.activa.persistence.spi.bind;

import io.intellixity.activa.persistence.compile.Bind;
import io.intellixity.activa.persistence.types.ColumnType;
import io.intellixity.activa.persistence.types.TypeAdapterRegistry;
import io.intellixity.activa.persistence.types.UnregisteredTypeException;
import io.intellixity.activa.persistence.types.adapters.BooleanAdapter;
import io.intellixity.activa.persistence.types.adapters.DefaultTypeAdapterProvider;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class DiscoveredBinderRegistryTest {
  record Ctx(BindOpKind opKind, ColumnType columnType) implements BindContext {}

  static final class Recorder {
    final List<String> calls = new ArrayList<>();
  }

  static Binder<Recorder, Object> binder(String name, Class<?> accepts) {
    return new Binder<>() {
      @Override public Class<Recorder> targetType() { return Recorder.class; }
      @Override public Class<Object> valueType() { return Object.class; }
      @Override public boolean supports(BindContext ctx, Bind bind, Object v) { return v == null || accepts.isInstance(v); }
      @Override public void bind(Recorder target, BindContext ctx, Bind bind, Object v) { target.calls.add(name + ":" + v); }
    };
  }

  static BinderProvider provider(String dialectId, Binder<?, ?>... binders) {
    return new BinderProvider() {
      @Override public String dialectId() { return dialectId; }
      @Override public Collection<Binder<?, ?>> binders() { return List.of(binders); }
    };
  }

  @Test
  void dialectBindersWinOverGlobal() {
    DiscoveredBinderRegistry reg = new DiscoveredBinderRegistry("postgres", List.of(
        provider("*", binder("global", Object.class)),
        provider("postgres", binder("pg", String.class)),
        provider("oracle", binder("ora", Object.class))));
    Recorder r = new Recorder();
    Ctx ctx = new Ctx(BindOpKind.QUERY, ColumnType.TEXT);

    reg.bind(r, ctx, Bind.of("x"), "x");
    reg.bind(r, ctx, Bind.of(5), 5);

    assertEquals(List.of("pg:x", "global:5"), r.calls);
  }

  @Test
  void failsWhenNothingMatches() {
    DiscoveredBinderRegistry reg = new DiscoveredBinderRegistry("sqlite", List.of(provider("*", binder("s", String.class))));
    Recorder r = new Recorder();
    assertThrows(IllegalArgumentException.class,
        () -> reg.bind(r, new Ctx(BindOpKind.QUERY, ColumnType.INTEGER), Bind.of(1), 1));
    assertThrows(IllegalArgumentException.class, () -> reg.bind(r, new Ctx(null, null), Bind.of("a"), "a"));
  }

  @Test
  void encoderResolvesAdaptersAtBindTime() {
    TypeAdapterRegistry types = new TypeAdapterRegistry("sqlite", List.of(new DefaultTypeAdapterProvider()));
    BindEncoder encoder = new BindEncoder(types);
    Bind flag = Bind.of(true);

    assertEquals(new BindEncoder.Encoded(true, ColumnType.BOOLEAN), encoder.encode(flag));
    types.register(new BooleanAdapter(true));
    assertEquals(new BindEncoder.Encoded(1, ColumnType.INTEGER), encoder.encode(flag));

    assertEquals(new BindEncoder.Encoded(null, ColumnType.TEXT), encoder.encode(new Bind(null, String.class, null)));
    assertEquals(new BindEncoder.Encoded(null, null), encoder.encode(Bind.of(null)));
    assertThrows(UnregisteredTypeException.class, () -> encoder.encode(Bind.of(new Object())));
  }
}
