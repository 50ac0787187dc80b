package xyz.jphil.imagebatch.tools.batch;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class OutputPathResolverTest {

    @TempDir
    Path out;

    @Test
    void keepsNamesAndExtensionsByDefault() throws Exception {
        var resolver = new OutputPathResolver(out, null, null);
        var outputs = resolver.resolve(List.of(Path.of("a/cat.png"), Path.of("b/dog.JPG")));

        assertEquals(List.of(out.resolve("cat.png"), out.resolve("dog.JPG")), outputs);
    }

    @Test
    void explicitFormatReplacesEveryExtension() throws Exception {
        var resolver = new OutputPathResolver(out, null, "jpeg");
        var outputs = resolver.resolve(List.of(Path.of("a/cat.png"), Path.of("b/dog.bmp")));

        assertEquals(List.of(out.resolve("cat.jpg"), out.resolve("dog.jpg")), outputs);
    }

    @Test
    void nameExpressionNumbersOutputsFromZero() throws Exception {
        var resolver = new OutputPathResolver(out, "pet.gif", null);
        var outputs = resolver.resolve(List.of(Path.of("a/cat.png"), Path.of("b/dog.bmp"), Path.of("c/cow.tif")));

        assertEquals(List.of(out.resolve("pet_0.gif"), out.resolve("pet_1.gif"), out.resolve("pet_2.gif")), outputs);
    }

    @Test
    void explicitFormatWinsOverExpressionExtension() throws Exception {
        var resolver = new OutputPathResolver(out, "pet.gif", "png");
        assertEquals(List.of(out.resolve("pet_0.png")), resolver.resolve(List.of(Path.of("cat.bmp"))));
    }

    @Test
    void expressionWithoutExtensionKeepsSourceExtensions() throws Exception {
        var resolver = new OutputPathResolver(out, "pet", null);
        var outputs = resolver.resolve(List.of(Path.of("cat.bmp"), Path.of("dog.png")));
        assertEquals(List.of(out.resolve("pet_0.bmp"), out.resolve("pet_1.png")), outputs);
    }

    @Test
    void sameLengthAndOrderAsInput() throws Exception {
        var sources = List.of(Path.of("z.png"), Path.of("a.png"), Path.of("m.png"));
        var outputs = new OutputPathResolver(out, null, null).resolve(sources);

        assertEquals(sources.size(), outputs.size());
        for (int i = 0; i < sources.size(); i++) {
            assertEquals(sources.get(i).getFileName(), outputs.get(i).getFileName());
        }
    }

    @Test
    void collidingOutputsAreAnError() {
        var resolver = new OutputPathResolver(out, null, "png");
        var e = assertThrows(ConfigurationException.class,
            () -> resolver.resolve(List.of(Path.of("a/cat.png"), Path.of("b/cat.bmp"))));
        assertTrue(e.getMessage().contains("collision"), e.getMessage());
    }

    @Test
    void namesDifferingOnlyInCaseCollide() {
        var resolver = new OutputPathResolver(out, null, "png");
        var e = assertThrows(ConfigurationException.class,
            () -> resolver.resolve(List.of(Path.of("a/Cat.png"), Path.of("b/cat.jpg"))));
        assertTrue(e.getMessage().contains("collision"), e.getMessage());
    }

    @Test
    void sourceWithoutExtensionNeedsAFormat() throws Exception {
        var resolver = new OutputPathResolver(out, null, null);
        assertThrows(ConfigurationException.class, () -> resolver.resolve(List.of(Path.of("README"))));

        var withFormat = new OutputPathResolver(out, null, "png");
        assertEquals(List.of(out.resolve("README.png")), withFormat.resolve(List.of(Path.of("README"))));
    }

    @Test
    void missingDestinationIsRejected() {
        var resolver = new OutputPathResolver(out.resolve("missing"), null, null);
        var e = assertThrows(ConfigurationException.class, resolver::validate);
        assertTrue(e.getMessage().contains("does not exist"), e.getMessage());
    }

    @Test
    void fileDestinationIsRejected() throws Exception {
        var file = Files.createFile(out.resolve("file.txt"));
        var e = assertThrows(ConfigurationException.class, () -> new OutputPathResolver(file, null, null).validate());
        assertTrue(e.getMessage().contains("is a file"), e.getMessage());
    }

    @Test
    void invalidExpressionsAndFormatsAreRejected() {
        assertThrows(ConfigurationException.class, () -> new OutputPathResolver(out, "../pet", null).validate());
        assertThrows(ConfigurationException.class, () -> new OutputPathResolver(out, "  ", null).validate());
        assertThrows(ConfigurationException.class, () -> new OutputPathResolver(out, "pet.xyz", null).validate());
        assertThrows(ConfigurationException.class, () -> new OutputPathResolver(out, null, "webp").validate());
    }
}
