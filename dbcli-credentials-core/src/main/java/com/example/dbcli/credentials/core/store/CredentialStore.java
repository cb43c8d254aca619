package com.example.dbcli.credentials.core.store;

import com.example.dbcli.credentials.core.CommandException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Namespaced key-value store backed by a single JSON document.
 *
 * <p>Every operation reads the whole document and writes it back whole. There is no file locking:
 * the store belongs to one process running one command, and two concurrent invocations of the CLI
 * may overwrite each other's changes.
 *
 * @param <E> entry type stored under each namespace
 */
public abstract class CredentialStore<E> {

  private static final System.Logger LOGGER = System.getLogger(CredentialStore.class.getName());

  /** Shared mapper; entries are plain records. */
  protected static final ObjectMapper MAPPER =
      new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

  private final Path file;
  private final JavaType entryType;

  protected CredentialStore(final Path file, final JavaType entryType) {
    this.file = file;
    this.entryType = entryType;
  }

  /**
   * Returns the entry stored under the namespace.
   *
   * @param namespace the namespace key
   * @return the entry, or empty if absent
   */
  public Optional<E> get(final String namespace) {
    if (namespace == null) return Optional.empty();
    return Optional.ofNullable(readDocument().get(namespace))
        .filter(node -> !node.isNull())
        .map(this::toEntry);
  }

  /**
   * Stores the entry under the namespace, replacing any previous entry.
   *
   * @param namespace the namespace key
   * @param entry the entry to store
   */
  public void save(final String namespace, final E entry) {
    final var document = readDocument();
    document.set(namespace, MAPPER.valueToTree(entry));
    writeDocument(document);
  }

  /**
   * Returns the full contents of the store, keyed by namespace.
   *
   * @return every namespace and its entry, in file order
   */
  public Map<String, E> getFile() {
    final var document = readDocument();
    final var contents = new LinkedHashMap<String, E>();
    document
        .fields()
        .forEachRemaining(
            field -> contents.put(field.getKey(), toEntry(field.getValue())));
    return contents;
  }

  /**
   * Returns the namespace names without reading the entries stored under them.
   *
   * @return every namespace, in file order
   */
  public Set<String> namespaces() {
    final var names = new LinkedHashSet<String>();
    readDocument().fieldNames().forEachRemaining(names::add);
    return names;
  }

  /**
   * Deletes a namespace and everything stored under it.
   *
   * @param namespace the namespace key
   * @return true if the namespace existed
   */
  public boolean delete(final String namespace) {
    final var document = readDocument();
    if (namespace == null || !document.has(namespace)) return false;
    document.remove(namespace);
    writeDocument(document);
    return true;
  }

  /** Location of the backing JSON document. */
  public Path file() {
    return file;
  }

  private E toEntry(final JsonNode node) {
    try {
      return MAPPER.convertValue(node, entryType);
    } catch (final IllegalArgumentException e) {
      throw new CommandException(
          "Credentials file at " + file + " contains invalid formatting.", e);
    }
  }

  /**
   * Reads the backing document. A missing or empty file reads as an empty document.
   *
   * @return the parsed document
   * @throws CommandException if the file exists but is not a JSON object
   */
  protected ObjectNode readDocument() {
    if (!Files.exists(file)) return MAPPER.createObjectNode();
    try {
      final var content = Files.readString(file, StandardCharsets.UTF_8);
      if (content.isBlank()) return MAPPER.createObjectNode();
      final var tree = MAPPER.readTree(content);
      if (tree instanceof ObjectNode object) return object;
      throw new CommandException("Credentials file at " + file + " contains invalid formatting.");
    } catch (final JsonProcessingException e) {
      throw new CommandException(
          "Credentials file at " + file + " contains invalid formatting.", e);
    } catch (final IOException e) {
      throw new CommandException("Error while reading credentials from " + file, e);
    }
  }

  /**
   * Replaces the backing document, creating parent directories when needed.
   *
   * @param document the new document
   */
  protected void writeDocument(final ObjectNode document) {
    try {
      final var parent = file.toAbsolutePath().getParent();
      if (parent != null) Files.createDirectories(parent);
      Files.writeString(file, MAPPER.writeValueAsString(document), StandardCharsets.UTF_8);
      LOGGER.log(System.Logger.Level.DEBUG, "Wrote credentials file {0}", file);
    } catch (final IOException e) {
      throw new CommandException("Error while saving credentials: " + e.getMessage(), e);
    }
  }
}
