package io.intellixity.sqlkit.schema;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class TableNamesTest {
  private static final class ContentFile {}
  private static final class HTTPServerLog {}

  @Test
  void lowerCaseUsesSimpleName() {
    assertEquals("contentfile", TableNames.lowerCase(ContentFile.class));
  }

  @Test
  void camelCapsBecomeUnderscores() {
    assertEquals("content_file", TableNames.camelCapsToUnderscores(ContentFile.class));
    assertEquals("http_server_log", TableNames.camelCapsToUnderscores(HTTPServerLog.class));
    assertEquals("foo_bar2_baz", TableNames.camelCapsToUnderscores("FooBar2Baz"));
    assertEquals("foo", TableNames.camelCapsToUnderscores("Foo"));
  }
}
