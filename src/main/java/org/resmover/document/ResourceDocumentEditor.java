package org.resmover.document;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Pattern;

import org.resmover.config.MoverSettings;
import org.resmover.resources.ResourceDependency;
import org.resmover.resources.ResourcePaths;
import org.resmover.resources.ResourceType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Performs the physical edits of a move or remove round.
 * <p>
 * Standalone resources (non-XML files and XML files whose root is not {@code <resources>})
 * are moved or deleted as whole files. Container documents are edited one child element at
 * a time; see {@link ResourceDocument#detach(DocumentNode)} for what travels with an element.
 * <p>
 * Each file is either rewritten through a temp file and an atomic rename, deleted, or left
 * untouched. A file that ends up with no edits is never written, so it stays byte-identical.
 */
public class ResourceDocumentEditor {

    private static final Logger log = LoggerFactory.getLogger(ResourceDocumentEditor.class);

    private static final String XML_EXTENSION = "xml";

    private final String resourceRoot;
    private final Set<String> resourceExtensions;
    private final String indentation;
    private final ResourceDocumentParser parser;

    public ResourceDocumentEditor(MoverSettings settings) {
        this(settings, new ResourceDocumentParser());
    }

    public ResourceDocumentEditor(MoverSettings settings, ResourceDocumentParser parser) {
        this.resourceRoot = settings.resourceRoot();
        this.resourceExtensions = settings.resourceExtensions();
        this.indentation = settings.indentation();
        this.parser = parser;
    }

    /**
     * @return the resource files of a module, in sorted order.
     * @throws IOException if the resource tree cannot be walked.
     */
    public List<Path> listResourceFiles(Path moduleRoot) throws IOException {
        return ResourcePaths.listFiles(moduleRoot.resolve(resourceRoot), resourceExtensions);
    }

    /**
     * Moves the given resources from every resource file of {@code fromModule} into the file at
     * the same relative path below {@code toModule}.
     *
     * @return the number of resources moved.
     * @throws IOException if a file cannot be read, parsed or written.
     */
    public int moveResources(Path fromModule, Path toModule, Set<ResourceDependency> toMove) throws IOException {
        int moved = 0;
        for (Path file : listResourceFiles(fromModule)) {
            Path destination = toModule.resolve(fromModule.relativize(file));
            moved += applyMove(file, destination, toMove);
        }
        return moved;
    }

    /**
     * Deletes every resource of {@code module} whose type is in {@code typeFilter}, that is not
     * in {@code toKeep} and whose name does not match {@code ignorePattern}.
     *
     * @return the number of resources removed.
     * @throws IOException if a file cannot be read, parsed, written or deleted.
     */
    public int removeResources(Path module, Set<ResourceType> typeFilter, Set<ResourceDependency> toKeep,
                               Pattern ignorePattern) throws IOException {
        int removed = 0;
        for (Path file : listResourceFiles(module)) {
            removed += applyRemove(file, typeFilter, toKeep, ignorePattern);
        }
        return removed;
    }

    /**
     * Moves the resources of one file.
     *
     * @param fromFile the source resource file.
     * @param toFile   the destination file, created if missing.
     * @param toMove   the resources to move.
     * @return the number of resources moved.
     * @throws IOException if a file cannot be read, parsed or written.
     */
    public int applyMove(Path fromFile, Path toFile, Set<ResourceDependency> toMove) throws IOException {
        if (!isXml(fromFile)) {
            return moveStandalone(fromFile, toFile, toMove);
        }

        ResourceDocument source = load(fromFile);
        if (!source.isContainer()) {
            return moveStandalone(fromFile, toFile, toMove);
        }

        List<DocumentNode> matching = new ArrayList<>();
        for (DocumentNode element : source.elements()) {
            if (ResourceUnits.dependency(element).map(toMove::contains).orElse(false)) {
                matching.add(element);
            }
        }
        if (matching.isEmpty()) {
            return 0;
        }

        ResourceDocument destination = Files.exists(toFile) ? load(toFile) : ResourceDocument.emptyContainer();
        if (!destination.isContainer()) {
            log.warn("Not moving {} resource(s) from {}: {} is not a <resources> document",
                matching.size(), fromFile, toFile);
            return 0;
        }

        Set<ResourceDependency> alreadyDefined = definedIn(destination);
        List<DocumentNode> content = new ArrayList<>();
        int moved = 0;
        for (DocumentNode element : matching) {
            ResourceDependency dependency = ResourceUnits.dependency(element).orElseThrow();
            if (alreadyDefined.contains(dependency)) {
                log.warn("Not moving {} from {}: {} already defines it", dependency, fromFile, toFile);
                continue;
            }
            content.addAll(source.detach(element));
            moved++;
        }
        if (moved == 0) {
            return 0;
        }

        destination.dropTrailingWhitespace();
        destination.append(content);
        destination.collapseLeadingWhitespace(indentation);
        destination.appendNewline();

        // Destination first: a failure in between leaves a duplicate rather than a lost resource.
        write(toFile, destination);
        saveOrDelete(fromFile, source);

        log.debug("Moved {} resource(s) from {} to {}", moved, fromFile, toFile);
        return moved;
    }

    /**
     * Removes unused resources from one file.
     *
     * @param file          the resource file.
     * @param typeFilter    the types eligible for removal.
     * @param toKeep        resources still referenced.
     * @param ignorePattern names matching it are kept; may be {@code null}.
     * @return the number of resources removed.
     * @throws IOException if the file cannot be read, parsed, written or deleted.
     */
    public int applyRemove(Path file, Set<ResourceType> typeFilter, Set<ResourceDependency> toKeep,
                           Pattern ignorePattern) throws IOException {
        if (!isXml(file)) {
            return removeStandalone(file, typeFilter, toKeep, ignorePattern);
        }

        ResourceDocument document = load(file);
        if (!document.isContainer()) {
            return removeStandalone(file, typeFilter, toKeep, ignorePattern);
        }

        List<DocumentNode> unused = new ArrayList<>();
        for (DocumentNode element : document.elements()) {
            Optional<ResourceDependency> dependency = ResourceUnits.dependency(element);
            if (dependency.isPresent()
                    && typeFilter.contains(dependency.get().type())
                    && !toKeep.contains(dependency.get())
                    && !matches(ignorePattern, ResourceUnits.rawName(element))) {
                unused.add(element);
            }
        }
        if (unused.isEmpty()) {
            return 0;
        }

        for (DocumentNode element : unused) {
            document.detach(element);
        }
        saveOrDelete(file, document);

        log.debug("Removed {} resource(s) from {}", unused.size(), file);
        return unused.size();
    }

    private int moveStandalone(Path fromFile, Path toFile, Set<ResourceDependency> toMove) throws IOException {
        Optional<ResourceDependency> dependency = ResourcePaths.standaloneDependency(fromFile);
        if (dependency.isEmpty() || !toMove.contains(dependency.get())) {
            return 0;
        }
        if (Files.exists(toFile)) {
            log.warn("Not moving {}: {} already exists", fromFile, toFile);
            return 0;
        }

        createParentDirectories(toFile);
        Files.move(fromFile, toFile);
        log.debug("Moved {} to {}", fromFile, toFile);
        return 1;
    }

    private int removeStandalone(Path file, Set<ResourceType> typeFilter, Set<ResourceDependency> toKeep,
                                 Pattern ignorePattern) throws IOException {
        Optional<ResourceDependency> dependency = ResourcePaths.standaloneDependency(file);
        if (dependency.isEmpty()
                || !typeFilter.contains(dependency.get().type())
                || toKeep.contains(dependency.get())
                || matches(ignorePattern, ResourcePaths.resourceName(file))) {
            return 0;
        }

        Files.delete(file);
        log.debug("Deleted {}", file);
        return 1;
    }

    private ResourceDocument load(Path file) throws IOException {
        String text = Files.readString(file, StandardCharsets.UTF_8);
        return parser.parse(EscapeSequences.protect(text), file.toString());
    }

    private void saveOrDelete(Path file, ResourceDocument document) throws IOException {
        if (document.childElementCount() == 0) {
            Files.delete(file);
            log.debug("Deleted emptied document {}", file);
        } else {
            write(file, document);
        }
    }

    private void write(Path file, ResourceDocument document) throws IOException {
        createParentDirectories(file);
        byte[] data = EscapeSequences.restore(document.serialize()).getBytes(StandardCharsets.UTF_8);

        // Atomic write: temp file -> atomic move
        Path tempFile = file.resolveSibling(file.getFileName() + "." + UUID.randomUUID() + ".tmp");
        Files.write(tempFile, data);
        try {
            Files.move(tempFile, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            try {
                Files.deleteIfExists(tempFile);
            } catch (IOException cleanupEx) {
                log.warn("Failed to clean up temp file after move failure: {}", tempFile, cleanupEx);
            }
            throw e;
        }
    }

    private static Set<ResourceDependency> definedIn(ResourceDocument document) {
        Set<ResourceDependency> defined = new HashSet<>();
        for (DocumentNode element : document.elements()) {
            ResourceUnits.dependency(element).ifPresent(defined::add);
        }
        return defined;
    }

    private static void createParentDirectories(Path file) throws IOException {
        Path parent = file.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }

    private static boolean isXml(Path file) {
        return XML_EXTENSION.equals(ResourcePaths.extension(file));
    }

    private static boolean matches(Pattern pattern, String name) {
        return pattern != null && name != null && pattern.matcher(name).find();
    }
}
