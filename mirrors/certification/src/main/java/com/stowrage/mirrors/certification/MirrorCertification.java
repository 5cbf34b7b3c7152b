package com.stowrage.mirrors.certification;

import com.stowrage.core.Mirror;
import com.stowrage.core.MirrorRow;
import com.stowrage.core.errors.MirrorException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Behaviour every {@link Mirror} implementation must share. Subclasses assign a fresh, empty,
 * initialized mirror in {@link #init()}.
 */
public abstract class MirrorCertification {
    protected Mirror mirror;

    public abstract void init();

    @BeforeEach
    public void setUp() throws Exception {
        init();
    }

    private List<Long> ids() {
        return mirror.rows().stream().map(MirrorRow::id).collect(Collectors.toList());
    }

    @Test
    public void initializeShouldBeRepeatable() {
        mirror.insert(new MirrorRow(0, "a", "1"));

        mirror.initialize();

        assertEquals(1, mirror.rows().size());
    }

    @Test
    public void insertShouldStoreTheRow() {
        MirrorRow row = new MirrorRow(0, "hen", "{\"eggs\":3}");

        mirror.insert(row);

        assertEquals(List.of(row), mirror.rows());
    }

    @Test
    public void rowsShouldComeBackOrderedById() {
        mirror.insert(new MirrorRow(4, "d", "4"));
        mirror.insert(new MirrorRow(1, "a", "1"));
        mirror.insert(new MirrorRow(2, "b", "2"));

        assertEquals(List.of(1L, 2L, 4L), ids());
    }

    @Test
    public void insertingATakenIdShouldFail() {
        mirror.insert(new MirrorRow(0, "a", "1"));

        assertThrows(MirrorException.class, () -> mirror.insert(new MirrorRow(0, "b", "2")));
    }

    @Test
    public void replaceShouldOverwriteTheRowWithTheSameId() {
        mirror.insert(new MirrorRow(0, "a", "1"));
        mirror.insert(new MirrorRow(1, "b", "2"));

        mirror.replace(new MirrorRow(0, "a", "10"));

        assertEquals(List.of(new MirrorRow(0, "a", "10"), new MirrorRow(1, "b", "2")), mirror.rows());
    }

    @Test
    public void replaceShouldInsertAMissingRow() {
        mirror.replace(new MirrorRow(3, "c", "3"));

        assertEquals(List.of(new MirrorRow(3, "c", "3")), mirror.rows());
    }

    @Test
    public void deleteByIdShouldRemoveOnlyThatRow() {
        mirror.insert(new MirrorRow(0, "a", "1"));
        mirror.insert(new MirrorRow(1, "b", "2"));

        mirror.deleteById(0);
        mirror.deleteById(9);

        assertEquals(List.of(1L), ids());
    }

    @Test
    public void deleteByNameShouldRemoveTheNamedRow() {
        mirror.insert(new MirrorRow(0, "a", "1"));
        mirror.insert(new MirrorRow(1, "b", "2"));

        mirror.deleteByName("b");

        assertEquals(List.of(0L), ids());
    }

    @Test
    public void deleteBetweenShouldIncludeBothEnds() {
        for (int i = 0; i < 6; i++) {
            mirror.insert(new MirrorRow(i, "n" + i, String.valueOf(i)));
        }

        mirror.deleteBetween(1, 3);

        assertEquals(List.of(0L, 4L, 5L), ids());
    }

    @Test
    public void deleteAllShouldEmptyTheTable() {
        mirror.insert(new MirrorRow(0, "a", "1"));
        mirror.insert(new MirrorRow(1, "b", "2"));

        mirror.deleteAll();

        assertTrue(mirror.rows().isEmpty());
    }

    @Test
    public void dataShouldBeKeptVerbatim() {
        String json = "{\"name\":\"Henrietta\",\"tags\":[\"brown\",\"loud\"],\"weight\":2.5}";

        mirror.insert(new MirrorRow(0, "hen", json));

        assertEquals(json, mirror.rows().get(0).data());
    }
}
