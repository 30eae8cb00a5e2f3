package com.adlanda.codexai.content;

import com.adlanda.codexai.config.ContentProperties;
import com.adlanda.codexai.exception.IndexBackendException;
import com.adlanda.codexai.model.CharacterEntry;
import com.adlanda.codexai.model.ChunkMetadata;
import com.adlanda.codexai.model.EntityType;
import com.adlanda.codexai.model.IndexableFile;
import com.adlanda.codexai.model.SceneEntry;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.*;
import java.util.stream.Stream;

/**
 * Content store over the on-disk project layout.
 *
 * <pre>
 * &lt;base&gt;/&lt;project&gt;/plan.md, synopsis.md, world.md
 * &lt;base&gt;/&lt;project&gt;/project_meta.json                    characters: {id: {name}}
 * &lt;base&gt;/&lt;project&gt;/chapters/&lt;chapter&gt;/chapter_meta.json  scenes: {id: {title, order}}
 * &lt;base&gt;/&lt;project&gt;/chapters/&lt;chapter&gt;/&lt;scene&gt;.md
 * &lt;base&gt;/&lt;project&gt;/characters/&lt;character&gt;.md
 * </pre>
 */
@Component
public class FileSystemContentStore implements ContentStore {

    private static final Logger log = LoggerFactory.getLogger(FileSystemContentStore.class);

    private static final Map<String, EntityType> CONTENT_BLOCKS = Map.of(
            "plan.md", EntityType.PLAN,
            "synopsis.md", EntityType.SYNOPSIS,
            "world.md", EntityType.WORLD
    );

    private final Path baseDir;
    private final ObjectMapper objectMapper;

    public FileSystemContentStore(ContentProperties properties, ObjectMapper objectMapper) {
        this.baseDir = Path.of(properties.getBaseDir()).toAbsolutePath().normalize();
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean projectExists(String projectId) {
        return isSafeSegment(projectId) && Files.isDirectory(baseDir.resolve(projectId));
    }

    @Override
    public boolean chapterExists(String projectId, String chapterId) {
        return projectExists(projectId)
                && isSafeSegment(chapterId)
                && Files.isDirectory(chaptersDir(projectId).resolve(chapterId));
    }

    @Override
    public Optional<String> read(String projectId, String relativePath) {
        Optional<Path> file = resolve(projectId, relativePath);
        if (file.isEmpty() || !Files.isRegularFile(file.get())) {
            return Optional.empty();
        }
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(file.get());
        } catch (NoSuchFileException e) {
            // Deleted between the check and the read
            return Optional.empty();
        } catch (IOException e) {
            throw new IndexBackendException("Content store read of " + projectId + "/" + relativePath
                    + " failed: " + e.getMessage(), e);
        }
        return Optional.of(decode(bytes, projectId + "/" + relativePath));
    }

    /**
     * Decodes file content as UTF-8. Malformed bytes become U+FFFD instead of failing the read.
     */
    static String decode(byte[] bytes, String sourcePath) {
        try {
            return StandardCharsets.UTF_8.newDecoder().decode(ByteBuffer.wrap(bytes)).toString();
        } catch (CharacterCodingException e) {
            log.warn("{} is not valid UTF-8, replacing malformed bytes", sourcePath);
            return new String(bytes, StandardCharsets.UTF_8);
        }
    }

    @Override
    public List<IndexableFile> listIndexable(String projectId) {
        if (!projectExists(projectId)) {
            return List.of();
        }
        Path projectDir = baseDir.resolve(projectId);
        List<IndexableFile> files = new ArrayList<>();

        CONTENT_BLOCKS.keySet().stream()
                .sorted()
                .filter(block -> Files.isRegularFile(projectDir.resolve(block)))
                .forEach(block -> describe(projectId, block).ifPresent(files::add));

        for (String chapterId : listDirectories(chaptersDir(projectId))) {
            for (String fileName : listMarkdownFiles(chaptersDir(projectId).resolve(chapterId))) {
                describe(projectId, "chapters/" + chapterId + "/" + fileName).ifPresent(files::add);
            }
        }

        Map<String, String> names = characterNames(projectId);
        for (String fileName : listMarkdownFiles(projectDir.resolve("characters"))) {
            String characterId = stem(fileName);
            files.add(new IndexableFile("characters/" + fileName,
                    ChunkMetadata.character(names.getOrDefault(characterId, characterId))));
        }

        log.debug("Found {} indexable files in project {}", files.size(), projectId);
        return files;
    }

    @Override
    public Optional<IndexableFile> describe(String projectId, String relativePath) {
        String path = SourcePaths.normalize(relativePath);
        if (!path.toLowerCase(Locale.ROOT).endsWith(".md")) {
            return Optional.empty();
        }
        String[] parts = path.split("/");
        if (Arrays.asList(parts).contains("..")) {
            return Optional.empty();
        }

        if (parts.length == 1 && CONTENT_BLOCKS.containsKey(parts[0])) {
            return Optional.of(new IndexableFile(path, ChunkMetadata.of(CONTENT_BLOCKS.get(parts[0]))));
        }
        if (parts.length == 3 && parts[0].equals("chapters")) {
            return Optional.of(new IndexableFile(path, ChunkMetadata.of(EntityType.SCENE)));
        }
        if (parts.length == 2 && parts[0].equals("characters")) {
            String characterId = stem(parts[1]);
            String name = characterNames(projectId).getOrDefault(characterId, characterId);
            return Optional.of(new IndexableFile(path, ChunkMetadata.character(name)));
        }
        return Optional.empty();
    }

    @Override
    public List<String> listProjects() {
        return listDirectories(baseDir);
    }

    @Override
    public List<SceneEntry> listScenes(String projectId, String chapterId) {
        if (!chapterExists(projectId, chapterId)) {
            return List.of();
        }
        Path chapterDir = chaptersDir(projectId).resolve(chapterId);
        String prefix = "chapters/" + chapterId + "/";
        JsonNode scenes = readJson(chapterDir.resolve("chapter_meta.json")).path("scenes");

        List<SceneEntry> entries = new ArrayList<>();
        if (scenes.isObject() && !scenes.isEmpty()) {
            scenes.fields().forEachRemaining(field -> {
                JsonNode scene = field.getValue();
                entries.add(new SceneEntry(
                        field.getKey(),
                        scene.path("title").asText(field.getKey()),
                        scene.path("order").asInt(Integer.MAX_VALUE),
                        prefix + field.getKey() + ".md"));
            });
        } else {
            // No metadata: fall back to file name order
            List<String> files = listMarkdownFiles(chapterDir);
            for (int i = 0; i < files.size(); i++) {
                String sceneId = stem(files.get(i));
                entries.add(new SceneEntry(sceneId, sceneId, i + 1, prefix + files.get(i)));
            }
        }
        entries.sort(Comparator.comparingInt(SceneEntry::order).thenComparing(SceneEntry::id));
        return entries;
    }

    @Override
    public List<CharacterEntry> listCharacters(String projectId) {
        if (!projectExists(projectId)) {
            return List.of();
        }
        Map<String, String> names = characterNames(projectId);
        return listMarkdownFiles(baseDir.resolve(projectId).resolve("characters")).stream()
                .map(fileName -> {
                    String characterId = stem(fileName);
                    return new CharacterEntry(characterId, names.getOrDefault(characterId, characterId),
                            "characters/" + fileName);
                })
                .toList();
    }

    private Map<String, String> characterNames(String projectId) {
        JsonNode characters = readJson(baseDir.resolve(projectId).resolve("project_meta.json")).path("characters");
        Map<String, String> names = new HashMap<>();
        characters.fields().forEachRemaining(field -> {
            String name = field.getValue().path("name").asText("");
            if (!name.isBlank()) {
                names.put(field.getKey(), name);
            }
        });
        return names;
    }

    private JsonNode readJson(Path file) {
        if (!Files.isRegularFile(file)) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(file.toFile());
        } catch (IOException e) {
            log.warn("Ignoring unreadable metadata file {}: {}", file, e.getMessage());
            return objectMapper.createObjectNode();
        }
    }

    private Optional<Path> resolve(String projectId, String relativePath) {
        if (!isSafeSegment(projectId)) {
            return Optional.empty();
        }
        Path projectDir = baseDir.resolve(projectId);
        Path file = projectDir.resolve(SourcePaths.normalize(relativePath)).normalize();
        if (!file.startsWith(projectDir)) {
            log.warn("Rejected path outside project {}: {}", projectId, relativePath);
            return Optional.empty();
        }
        return Optional.of(file);
    }

    private Path chaptersDir(String projectId) {
        return baseDir.resolve(projectId).resolve("chapters");
    }

    private List<String> listDirectories(Path dir) {
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> paths = Files.list(dir)) {
            return paths.filter(Files::isDirectory)
                    .map(p -> p.getFileName().toString())
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new IndexBackendException("Content store listing of " + dir + " failed: " + e.getMessage(), e);
        }
    }

    private List<String> listMarkdownFiles(Path dir) {
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> paths = Files.list(dir)) {
            return paths.filter(Files::isRegularFile)
                    .map(p -> p.getFileName().toString())
                    .filter(name -> name.toLowerCase(Locale.ROOT).endsWith(".md"))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new IndexBackendException("Content store listing of " + dir + " failed: " + e.getMessage(), e);
        }
    }

    private static boolean isSafeSegment(String id) {
        return id != null && !id.isBlank() && !id.contains("/") && !id.contains("\\") && !id.contains("..");
    }

    private static String stem(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot < 0 ? fileName : fileName.substring(0, dot);
    }
}
