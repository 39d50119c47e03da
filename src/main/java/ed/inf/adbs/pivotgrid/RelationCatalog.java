package ed.inf.adbs.pivotgrid;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * The RelationCatalog knows which relations live in a directory and loads them
 * as key/payload maps ready for a {@link PivotIndex}.
 * It implements the singleton pattern so every part of an application sees
 * the same set of relations.
 * <p>The directory holds a {@code schema.txt} file with one line per relation,
 * {@code <name> <dimension> <dimension> ...}, and a {@code data} directory with
 * one {@code <name>.csv} file per relation. Each data line lists the dimension
 * values followed by the payload, comma separated. Integer tokens are read as
 * {@code Integer}, anything else as {@code String}. An empty dimension token is
 * an unresolved component and an empty payload means "no payload".
 */
public class RelationCatalog {

    private static RelationCatalog instance;

    private final Map<String, Path> relationLocations;
    private final Map<String, List<String>> relationDimensions;

    private RelationCatalog() {
        relationLocations = new HashMap<>();
        relationDimensions = new HashMap<>();
    }

    /**
     * Returns the singleton instance of RelationCatalog.
     * Creates an empty one if none has been initialised.
     * @return The singleton RelationCatalog instance
     */
    public static RelationCatalog getInstance() {
        if (instance == null) {
            instance = new RelationCatalog();
            System.err.println("Created RelationCatalog without content, use initRelationCatalog() instead");
        }
        return instance;
    }

    /**
     * Initialises the catalog from a directory. Has no effect if the catalog
     * is already initialised.
     * @param directory The directory containing the schema file and the data directory
     */
    public static void initRelationCatalog(String directory) {
        if (instance == null) {
            instance = new RelationCatalog();
            instance.loadRelationCatalog(directory);
        }
    }

    /**
     * Drops the singleton so the next initialisation reads a directory afresh.
     */
    public static void resetRelationCatalog() {
        instance = null;
    }

    private void loadRelationCatalog(String directory) {
        Path path = Paths.get(directory);
        Path schemaPath = path.resolve(Constants.SCHEMA_FILE_NAME);
        Path dataPath = path.resolve(Constants.DATA_DIRECTORY_NAME);
        try (BufferedReader schemaReader = Files.newBufferedReader(schemaPath)) {
            String line;
            while ((line = schemaReader.readLine()) != null) {
                if (line.trim().isEmpty()) {
                    continue;
                }
                String[] parts = line.trim().split(Constants.SPLITTER_REGEX);
                String relationName = parts[0];
                List<String> dimensions = new ArrayList<>();
                for (int i = 1; i < parts.length; i++) {
                    dimensions.add(parts[i]);
                }
                relationDimensions.put(relationName, Collections.unmodifiableList(dimensions));
                relationLocations.put(relationName, dataPath.resolve(relationName + Constants.DATA_FILE_EXTENSION));
            }
        } catch (IOException e) {
            System.err.println("Error loading relation schema: " + e.getMessage());
            return;
        }

        if (Files.isDirectory(dataPath)) {
            try (Stream<Path> files = Files.list(dataPath)) {
                files.forEach(file -> {
                    String fileName = file.getFileName().toString();
                    if (fileName.endsWith(Constants.DATA_FILE_EXTENSION)) {
                        String relationName = fileName.substring(0,
                                fileName.length() - Constants.DATA_FILE_EXTENSION.length());
                        if (!relationDimensions.containsKey(relationName)) {
                            System.err.println("Warning: Found data file " + fileName + " but no schema definition");
                        }
                    }
                });
            } catch (IOException e) {
                System.err.println("Error listing relation data files: " + e.getMessage());
            }
        }
    }

    /**
     * Checks if a relation is known to the catalog.
     * @param relationName The name of the relation
     * @return true if the schema file declares the relation
     */
    public boolean relationExists(String relationName) {
        return relationDimensions.containsKey(relationName);
    }

    /**
     * @param relationName The name of the relation
     * @return The dimension ids in canonical key order, or null for an unknown relation
     */
    public List<String> getDimensionIds(String relationName) {
        return relationDimensions.get(relationName);
    }

    /**
     * @param relationName The name of the relation
     * @return The dimensions of the relation, all of entity kind
     */
    public List<Dimension> getDimensions(String relationName) {
        List<Dimension> dimensions = new ArrayList<>();
        for (String id : requireRelation(relationName)) {
            dimensions.add(Dimension.entity(id));
        }
        return dimensions;
    }

    /**
     * @param relationName The name of the relation
     * @return The data file of the relation, or null for an unknown relation
     */
    public Path getRelationLocation(String relationName) {
        return relationLocations.get(relationName);
    }

    /**
     * Read the whole relation. Malformed lines are reported and skipped; a
     * data file that cannot be read yields an empty relation.
     * @param relationName The name of the relation
     * @return Entries in file order
     * @throws IllegalArgumentException if the relation is unknown
     */
    public LinkedHashMap<Tuple, String> loadRelation(String relationName) {
        int arity = requireRelation(relationName).size();
        LinkedHashMap<Tuple, String> relation = new LinkedHashMap<>();
        Path location = relationLocations.get(relationName);
        try (BufferedReader reader = Files.newBufferedReader(location)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.trim().isEmpty()) {
                    continue;
                }
                String[] fields = line.split(Constants.FIELD_SPLITTER_REGEX, -1);
                if (fields.length != arity + 1) {
                    System.err.println("Warning: skipping line " + lineNumber + " of " + location.getFileName()
                            + ", expected " + (arity + 1) + " fields but got " + fields.length);
                    continue;
                }
                List<Optional<Object>> key = new ArrayList<>(arity);
                for (int i = 0; i < arity; i++) {
                    key.add(Optional.ofNullable(parseValue(fields[i])));
                }
                String payload = fields[arity].trim();
                relation.put(Tuple.ofOptionals(key), payload.isEmpty() ? null : payload);
            }
        } catch (IOException e) {
            System.err.println("Failed to read relation " + relationName + ": " + e.getMessage());
            return new LinkedHashMap<>();
        }
        return relation;
    }

    private List<String> requireRelation(String relationName) {
        List<String> dimensions = relationDimensions.get(relationName);
        if (dimensions == null) {
            throw new IllegalArgumentException("Unknown relation '" + relationName + "'");
        }
        return dimensions;
    }

    /**
     * @param token A raw dimension token
     * @return The value, or null if the token is empty
     */
    static Object parseValue(String token) {
        String trimmed = token.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        try {
            return Integer.parseInt(trimmed);
        } catch (NumberFormatException e) {
            return trimmed;
        }
    }
}
