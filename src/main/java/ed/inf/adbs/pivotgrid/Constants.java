package ed.inf.adbs.pivotgrid;

/**
 * Defines global constants used throughout the pivot grid.
 * These include the default fetch granularity of the grid, the names of the
 * files making up a relation catalog, and the token splitters used when loading it.
 */
public class Constants {

    /** Number of rows or columns materialised by one fetch-more call */
    public static final int DEFAULT_FETCH_CHUNK_SIZE = 1024;

    /** Standard filename for relation schema definitions */
    public static final String SCHEMA_FILE_NAME = "schema.txt";

    /** Directory name where relation data files are stored */
    public static final String DATA_DIRECTORY_NAME = "data";

    /** File extension of relation data files */
    public static final String DATA_FILE_EXTENSION = ".csv";

    /** Regular expression used for splitting schema file entries */
    public static final String SPLITTER_REGEX = "\\s+";

    /** Regular expression used for splitting data file lines, keeps trailing empty tokens */
    public static final String FIELD_SPLITTER_REGEX = ",\\s*";
}
