package ed.inf.adbs.pivotgrid;

import static org.junit.Assert.*;

import java.io.BufferedWriter;
import java.io.FileWriter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

public class RelationCatalogTest {

    private static final String TEST_DIR = "src/test/resources/testrelations";
    private static final String SCHEMA_FILE = TEST_DIR + "/schema.txt";
    private static final String DATA_DIR = TEST_DIR + "/data";
    private static final String SALES = "Sales";
    private static final String EMPTY = "Empty";

    @Before
    public void setUp() throws IOException {
        Files.createDirectories(Paths.get(DATA_DIR));

        try (BufferedWriter writer = new BufferedWriter(new FileWriter(SCHEMA_FILE))) {
            writer.write(SALES + " region quarter\n");
            writer.write(EMPTY + " X\n");
        }

        try (BufferedWriter writer = new BufferedWriter(new FileWriter(DATA_DIR + "/" + SALES + ".csv"))) {
            writer.write("north, 1, 100\n");
            writer.write("north, 2, 120\n");
            writer.write("south, 1,\n");
            writer.write(", 3, 5\n");
            writer.write("broken line\n");
            writer.write("\n");
        }

        try (BufferedWriter writer = new BufferedWriter(new FileWriter(DATA_DIR + "/" + EMPTY + ".csv"))) {
            // Intentionally left empty
        }

        RelationCatalog.resetRelationCatalog();
        RelationCatalog.initRelationCatalog(TEST_DIR);
    }

    @After
    public void tearDown() throws IOException {
        RelationCatalog.resetRelationCatalog();
        Files.deleteIfExists(Paths.get(DATA_DIR + "/" + SALES + ".csv"));
        Files.deleteIfExists(Paths.get(DATA_DIR + "/" + EMPTY + ".csv"));
        Files.deleteIfExists(Paths.get(SCHEMA_FILE));
        Files.deleteIfExists(Paths.get(DATA_DIR));
        Files.deleteIfExists(Paths.get(TEST_DIR));
    }

    @Test
    public void testSchema() {
        RelationCatalog catalog = RelationCatalog.getInstance();

        assertTrue(catalog.relationExists(SALES));
        assertFalse(catalog.relationExists("Missing"));
        assertEquals(Arrays.asList("region", "quarter"), catalog.getDimensionIds(SALES));
        assertEquals(Arrays.asList(Dimension.entity("region"), Dimension.entity("quarter")),
                catalog.getDimensions(SALES));
        assertEquals(Paths.get(DATA_DIR, SALES + ".csv"), catalog.getRelationLocation(SALES));
    }

    @Test
    public void testLoadRelation() {
        LinkedHashMap<Tuple, String> relation = RelationCatalog.getInstance().loadRelation(SALES);

        assertEquals("Malformed and blank lines are skipped", 4, relation.size());
        List<Tuple> keys = Arrays.asList(relation.keySet().toArray(new Tuple[0]));
        assertEquals("File order is kept", Tuple.of("north", 1), keys.get(0));
        assertEquals("100", relation.get(Tuple.of("north", 1)));
        assertTrue("Empty payload is kept as a key", relation.containsKey(Tuple.of("south", 1)));
        assertNull(relation.get(Tuple.of("south", 1)));
        assertFalse("Empty dimension token is unresolved", keys.get(3).isResolved());
        assertEquals(3, keys.get(3).getAttribute(1));
    }

    @Test
    public void testLoadedRelationFeedsIndex() {
        RelationCatalog catalog = RelationCatalog.getInstance();
        PivotIndex<String> index = new PivotIndex<>();

        index.reset(catalog.loadRelation(SALES), catalog.getDimensionIds(SALES),
                Arrays.asList("region"), Arrays.asList("quarter"), Collections.<String>emptyList(),
                Tuple.empty());

        assertEquals(Arrays.asList(Tuple.of("north"), Tuple.of("south")), index.getRowHeader());
        assertEquals(Arrays.asList(Tuple.of(1), Tuple.of(2), Tuple.of(3)), index.getColumnHeader());
        assertEquals("120", index.getCell(0, 1));
    }

    @Test
    public void testEmptyRelation() {
        Map<Tuple, String> relation = RelationCatalog.getInstance().loadRelation(EMPTY);

        assertTrue(relation.isEmpty());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownRelation() {
        RelationCatalog.getInstance().loadRelation("Missing");
    }

    @Test
    public void testParseValue() {
        assertEquals(42, RelationCatalog.parseValue(" 42 "));
        assertEquals("4x", RelationCatalog.parseValue("4x"));
        assertNull(RelationCatalog.parseValue("  "));
    }
}
