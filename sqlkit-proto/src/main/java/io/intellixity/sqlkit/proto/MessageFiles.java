package io.intellixity.sqlkit.proto;

import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.Message;
import com.google.protobuf.TextFormat;
import com.google.protobuf.util.JsonFormat;
import io.intellixity.sqlkit.error.DeserializationException;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Reads and writes protocol buffer messages as files. The encoding follows the file suffix:
 * {@code .pbtxt} and {@code .txt} are text format, {@code .json} is JSON, anything else is binary wire format.
 */
public final class MessageFiles {
  public enum Encoding { BINARY, TEXT, JSON }

  private MessageFiles() {}

  public static Encoding encodingOf(Path path) {
    String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
    if (name.endsWith(".pbtxt") || name.endsWith(".txt")) return Encoding.TEXT;
    if (name.endsWith(".json")) return Encoding.JSON;
    return Encoding.BINARY;
  }

  /**
   * Parse the message at {@code path} as the type of {@code prototype}.
   *
   * @throws DeserializationException if the file is missing or malformed
   */
  public static <M extends Message> M read(Path path, M prototype) {
    if (!Files.isRegularFile(path)) throw new DeserializationException("File '" + path + "' not found");
    try {
      Message parsed = switch (encodingOf(path)) {
        case BINARY -> {
          try (InputStream in = Files.newInputStream(path)) {
            yield prototype.getParserForType().parseFrom(in);
          }
        }
        case TEXT -> {
          Message.Builder b = prototype.newBuilderForType();
          TextFormat.merge(Files.readString(path, StandardCharsets.UTF_8), b);
          yield b.build();
        }
        case JSON -> {
          Message.Builder b = prototype.newBuilderForType();
          JsonFormat.parser().merge(Files.readString(path, StandardCharsets.UTF_8), b);
          yield b.build();
        }
      };
      @SuppressWarnings("unchecked")
      M out = (M) parsed;
      return out;
    } catch (TextFormat.ParseException | InvalidProtocolBufferException e) {
      throw new DeserializationException("Failed to parse " + prototype.getDescriptorForType().getFullName()
          + " from '" + path + "'", e);
    } catch (IOException e) {
      throw new DeserializationException("Failed to read '" + path + "'", e);
    }
  }

  public static void write(Path path, Message message) throws IOException {
    switch (encodingOf(path)) {
      case BINARY -> {
        try (OutputStream out = Files.newOutputStream(path)) {
          message.writeTo(out);
        }
      }
      case TEXT -> Files.writeString(path, TextFormat.printer().printToString(message), StandardCharsets.UTF_8);
      case JSON -> Files.writeString(path, JsonFormat.printer().print(message), StandardCharsets.UTF_8);
    }
  }
}
