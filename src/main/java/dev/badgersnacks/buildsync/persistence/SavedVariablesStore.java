package dev.badgersnacks.buildsync.persistence;

import dev.badgersnacks.buildsync.config.UpdaterSettings;
import dev.badgersnacks.buildsync.model.BuildKey;
import dev.badgersnacks.buildsync.persistence.LuaValue.Assignment;
import dev.badgersnacks.buildsync.persistence.LuaValue.Field;
import dev.badgersnacks.buildsync.persistence.LuaValue.LuaString;
import dev.badgersnacks.buildsync.persistence.LuaValue.LuaTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reads and writes the addon's SavedVariables file. Entries in the builds table whose label ends
 * with the managed marker belong to this tool; every other byte of the file is preserved.
 *
 * <p>Placement on write: a replaced managed entry keeps its slot, new managed entries are
 * appended after the last existing entry, and a file without a builds table gets one appended as
 * a new top-level assignment.
 */
public final class SavedVariablesStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(SavedVariablesStore.class);
    private static final String DEFAULT_INDENT = "\t";

    private final String tableName;
    private final String managedMarker;
    private final boolean backupBeforeWrite;

    public SavedVariablesStore(UpdaterSettings settings) {
        this(settings.tableName(), settings.managedMarker(), settings.backupBeforeWrite());
    }

    public SavedVariablesStore(String tableName, String managedMarker, boolean backupBeforeWrite) {
        this.tableName = Objects.requireNonNull(tableName, "tableName");
        this.managedMarker = Objects.requireNonNull(managedMarker, "managedMarker");
        this.backupBeforeWrite = backupBeforeWrite;
    }

    public String managedMarker() {
        return managedMarker;
    }

    /**
     * Loads the document at {@code path}. A missing file yields an empty document.
     *
     * @throws DocumentParseException  if the file is not valid UTF-8 Lua
     * @throws DocumentSchemaException if the builds table is not shaped as expected
     */
    public SavedVariablesDocument load(Path path) throws IOException {
        if (!Files.exists(path)) {
            LOGGER.info("{} does not exist yet; starting from an empty document", path);
            return new SavedVariablesDocument(path, tableName, false, "", List.of(), "", DEFAULT_INDENT, "\n");
        }
        String source = decode(path, Files.readAllBytes(path));
        return parse(path, source);
    }

    SavedVariablesDocument parse(Path path, String source) throws IOException {
        List<Assignment> assignments;
        try {
            assignments = new LuaReader(source).readChunk();
        } catch (LuaSyntaxException e) {
            int[] lineColumn = lineAndColumn(source, e.offset());
            throw new DocumentParseException(path, lineColumn[0], lineColumn[1], e.getMessage());
        }
        String newline = source.contains("\r\n") ? "\r\n" : "\n";

        List<Assignment> targets = assignments.stream()
                .filter(assignment -> assignment.name().equals(tableName))
                .collect(Collectors.toList());
        if (targets.isEmpty()) {
            return new SavedVariablesDocument(path, tableName, false, source, List.of(), "", DEFAULT_INDENT, newline);
        }
        if (targets.size() > 1) {
            throw new DocumentSchemaException(path, tableName + " is assigned " + targets.size() + " times");
        }
        Assignment target = targets.get(0);
        if (!(target.value() instanceof LuaTable table)) {
            throw new DocumentSchemaException(path, tableName + " is not a table");
        }

        List<DocumentEntry> entries = new ArrayList<>();
        Set<BuildKey> seen = new HashSet<>();
        for (Field field : table.fields()) {
            String text = source.substring(field.start(), field.end());
            Optional<String> label = managedLabel(field);
            if (label.isEmpty()) {
                entries.add(new OpaqueEntry(text, field.separated()));
                continue;
            }
            ManagedEntry entry = toManagedEntry(path, label.get(), field, text);
            if (!seen.add(entry.key())) {
                throw new DocumentSchemaException(path, "duplicate managed entry for " + entry.key());
            }
            entries.add(entry);
        }

        int entriesStart = table.openIndex() + 1;
        int entriesEnd = table.fields().isEmpty()
                ? entriesStart
                : table.fields().get(table.fields().size() - 1).end();
        String prefix = source.substring(0, entriesStart);
        String suffix = source.substring(entriesEnd);
        String indent = table.fields().isEmpty()
                ? DEFAULT_INDENT
                : detectIndent(source.substring(table.fields().get(0).start(), table.fields().get(0).end()));
        LOGGER.debug("Loaded {} entries ({} managed) from {}", entries.size(), seen.size(), path);
        return new SavedVariablesDocument(path, tableName, true, prefix, entries, suffix, indent, newline);
    }

    /**
     * Removes every managed entry and returns how many were removed.
     */
    public int clearManaged(SavedVariablesDocument document) {
        return document.removeManaged();
    }

    /**
     * Inserts {@code entry}, replacing any managed entry with the same key. An existing entry with
     * identical content is left alone so its original text is kept.
     */
    public void upsert(SavedVariablesDocument document, ManagedEntry entry) {
        Optional<ManagedEntry> existing = document.find(entry.key());
        if (existing.isPresent() && sameContent(existing.get(), entry)) {
            return;
        }
        document.upsert(entry);
    }

    /**
     * Builds a managed entry whose label is {@code displayLabel} followed by the managed marker.
     */
    public ManagedEntry newEntry(BuildKey key, String className, String displayLabel, String buildCode) {
        return ManagedEntry.create(key, className, displayLabel + managedMarker, buildCode);
    }

    public byte[] serialize(SavedVariablesDocument document) {
        return render(document).getBytes(StandardCharsets.UTF_8);
    }

    String render(SavedVariablesDocument document) {
        List<DocumentEntry> entries = document.entries();
        String newline = document.newline();
        StringBuilder sb = new StringBuilder(document.prefix());
        if (!document.tablePresent()) {
            if (entries.isEmpty()) {
                return sb.toString();
            }
            if (sb.length() > 0 && sb.charAt(sb.length() - 1) != '\n') {
                sb.append(newline);
            }
            sb.append(document.tableName()).append(" = {");
        }

        boolean lastRendered = false;
        for (int i = 0; i < entries.size(); i++) {
            DocumentEntry entry = entries.get(i);
            if (entry instanceof OpaqueEntry opaque) {
                sb.append(opaque.text());
                lastRendered = false;
            } else if (entry instanceof ManagedEntry managed) {
                if (managed.fromSource()) {
                    sb.append(managed.sourceText());
                    lastRendered = false;
                } else {
                    sb.append(LuaWriter.renderEntry(managed, document.indent(), newline));
                    lastRendered = true;
                }
            }
            if (!entry.separated() && i < entries.size() - 1) {
                sb.append(',');
            }
        }

        if (!document.tablePresent()) {
            sb.append(newline).append('}').append(newline);
            return sb.toString();
        }
        String suffix = document.suffix();
        if (lastRendered && !suffix.startsWith("\n") && !suffix.startsWith("\r\n")) {
            sb.append(newline);
        }
        return sb.append(suffix).toString();
    }

    /**
     * Writes the document through a temporary file that is moved over {@code path}, so the
     * target is either fully replaced or left untouched.
     */
    public void write(SavedVariablesDocument document, Path path) throws DocumentWriteException {
        byte[] bytes = serialize(document);
        Path target = path.toAbsolutePath();
        try {
            Path parent = target.getParent();
            Files.createDirectories(parent);
            if (backupBeforeWrite && Files.isRegularFile(target)) {
                Path backup = target.resolveSibling(target.getFileName() + ".bak");
                Files.copy(target, backup, StandardCopyOption.REPLACE_EXISTING);
                LOGGER.info("Backed up {} to {}", target, backup);
            }
            Path temp = Files.createTempFile(parent, target.getFileName().toString(), ".tmp");
            try {
                Files.write(temp, bytes);
                moveIntoPlace(temp, target);
            } finally {
                Files.deleteIfExists(temp);
            }
        } catch (IOException e) {
            throw new DocumentWriteException(path, e);
        }
        LOGGER.info("Wrote {} bytes to {}", bytes.length, target);
    }

    private void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            LOGGER.debug("Atomic move not supported for {}, falling back to replace", target);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private Optional<String> managedLabel(Field field) {
        if (field.key() instanceof LuaString key && key.value().endsWith(managedMarker)) {
            return Optional.of(key.value());
        }
        return Optional.empty();
    }

    private ManagedEntry toManagedEntry(Path path, String label, Field field, String text)
            throws DocumentSchemaException {
        if (!(field.value() instanceof LuaTable table)) {
            throw new DocumentSchemaException(path, "managed entry '" + label + "' is not a table");
        }
        String code = requireString(path, label, table, LuaWriter.CODE);
        String character = requireString(path, label, table, LuaWriter.CHARACTER);
        String spec = requireString(path, label, table, LuaWriter.SPEC);
        String content = requireString(path, label, table, LuaWriter.CONTENT);
        String className = table.stringField(LuaWriter.CLASS).orElse("");
        if (code.isBlank()) {
            throw new DocumentSchemaException(path, "managed entry '" + label + "' has an empty code");
        }
        return new ManagedEntry(new BuildKey(character, spec, content), className, label, code, text,
                field.separated());
    }

    private static String requireString(Path path, String label, LuaTable table, String name)
            throws DocumentSchemaException {
        return table.stringField(name).orElseThrow(() -> new DocumentSchemaException(path,
                "managed entry '" + label + "' has no string field '" + name + "'"));
    }

    private static boolean sameContent(ManagedEntry a, ManagedEntry b) {
        return a.label().equals(b.label())
                && a.buildCode().equals(b.buildCode())
                && a.className().equals(b.className());
    }

    private static String decode(Path path, byte[] bytes) throws DocumentParseException {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new DocumentParseException(path, "file is not valid UTF-8", e);
        }
    }

    private static String detectIndent(String firstFieldText) {
        int contentStart = 0;
        while (contentStart < firstFieldText.length() && Character.isWhitespace(firstFieldText.charAt(contentStart))) {
            contentStart++;
        }
        String leading = firstFieldText.substring(0, contentStart);
        int newline = leading.lastIndexOf('\n');
        if (newline < 0) {
            return DEFAULT_INDENT;
        }
        String indent = leading.substring(newline + 1);
        return indent.isEmpty() ? DEFAULT_INDENT : indent;
    }

    private static int[] lineAndColumn(String source, int offset) {
        int line = 1;
        int column = 1;
        int limit = Math.min(offset, source.length());
        for (int i = 0; i < limit; i++) {
            if (source.charAt(i) == '\n') {
                line++;
                column = 1;
            } else {
                column++;
            }
        }
        return new int[]{line, column};
    }
}
