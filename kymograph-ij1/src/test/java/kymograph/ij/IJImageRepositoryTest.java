package kymograph.ij;

import ij.IJ;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.IOException;
import java.util.Arrays;
import java.util.Collections;

import static org.junit.Assert.*;

public class IJImageRepositoryTest {
    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void testOpenAndCache() throws IOException {
        File file = new File(folder.getRoot(), "movie.tif");
        IJ.saveAsTiff(IJTestImages.createMovie("movie", 20, 10, 1, 1, 3), file.getPath());
        IJImageRepository repository = new IJImageRepository(Arrays.asList(file.getPath(), new File(folder.getRoot(), "missing.tif").getPath()));
        IJSourceImage image = repository.getImage(0);
        assertEquals("sizeT", 3, image.getSizeT());
        assertEquals("sizeX", 20, image.getSizeX());
        assertSame("cached", image, repository.getImage(0));
        try {
            repository.getImage(1);
            fail("missing file");
        } catch (IOException e) {
            assertTrue(e.getMessage().contains("missing.tif"));
        }
    }

    @Test
    public void testAddOpenedImage() throws IOException {
        IJImageRepository repository = new IJImageRepository(Collections.emptyList());
        long id = repository.add(IJTestImages.createMovie("movie", 20, 10, 1, 1, 3));
        assertEquals("first id", 0, id);
        assertTrue(repository.contains(id));
        assertFalse(repository.contains(1));
        assertEquals("name", "movie", repository.getImage(id).getName());
    }

    @Test(expected = IOException.class)
    public void testUnknownId() throws IOException {
        new IJImageRepository(Collections.emptyList()).getImage(4);
    }
}
