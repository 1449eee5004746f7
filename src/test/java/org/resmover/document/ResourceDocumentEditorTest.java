package org.resmover.document;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.Set;
import java.util.regex.Pattern;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.resmover.config.MoverSettings;
import org.resmover.resources.ResourceDependency;
import org.resmover.resources.ResourceType;
import org.resmover.testing.ModuleFixture;

@Tag("unit")
class ResourceDocumentEditorTest {

    @TempDir
    Path tempDir;

    private final ResourceDocumentEditor editor = new ResourceDocumentEditor(MoverSettings.defaults());

    private ModuleFixture source;
    private ModuleFixture destination;

    @BeforeEach
    void setUp() {
        source = ModuleFixture.create(tempDir, "core");
        destination = ModuleFixture.create(tempDir, "checkout");
    }

    private static ResourceDependency string(String name) {
        return new ResourceDependency(ResourceType.STRING, name);
    }

    @Nested
    @DisplayName("Moving")
    class Moving {

        @Test
        void createsDestinationDocument() throws IOException {
            source.resource("values/strings.xml", ModuleFixture.values(
                "<string name=\"app_name\">Shop</string>",
                "<string name=\"checkout\">Checkout</string>"));

            int moved = editor.moveResources(source.root(), destination.root(), Set.of(string("checkout")));

            assertThat(moved).isEqualTo(1);
            assertThat(destination.readResource("values/strings.xml")).isEqualTo("""
                <?xml version="1.0" encoding="utf-8"?>
                <resources xmlns:tools="http://schemas.android.com/tools">
                    <string name="checkout">Checkout</string>
                </resources>
                """);
            assertThat(source.readResource("values/strings.xml"))
                .isEqualTo(ModuleFixture.values("<string name=\"app_name\">Shop</string>"));
        }

        @Test
        void appendsToExistingDestinationWithComment() throws IOException {
            source.resource("values/strings.xml", """
                <resources>
                    <string name="app_name">Shop</string>
                    <!-- Label on the checkout button -->
                    <string name="checkout">Checkout</string>
                </resources>
                """);
            destination.resource("values/strings.xml", """
                <resources>
                    <string name="pay">Pay</string>

                </resources>
                """);

            editor.moveResources(source.root(), destination.root(), Set.of(string("checkout")));

            assertThat(destination.readResource("values/strings.xml")).isEqualTo("""
                <resources>
                    <string name="pay">Pay</string>
                    <!-- Label on the checkout button -->
                    <string name="checkout">Checkout</string>
                </resources>
                """);
        }

        @Test
        void deletesEmptiedSourceDocument() throws IOException {
            source.resource("values/colors.xml", ModuleFixture.values("<color name=\"accent\">#FF0000</color>"));

            editor.moveResources(source.root(), destination.root(),
                Set.of(new ResourceDependency(ResourceType.COLOR, "accent")));

            assertThat(source.hasResource("values/colors.xml")).isFalse();
            assertThat(destination.readResource("values/colors.xml")).contains("<color name=\"accent\">#FF0000</color>");
        }

        @Test
        void leavesUntouchedFilesByteIdentical() throws IOException {
            String oddlyFormatted = "<?xml version='1.0'?>\r\n<resources>\t<dimen  name = \"gap\" >4dp</dimen>\r\n</resources>";
            source.resource("values/dimens.xml", oddlyFormatted);
            source.resource("values/strings.xml", ModuleFixture.values("<string name=\"checkout\">Checkout</string>"));

            editor.moveResources(source.root(), destination.root(), Set.of(string("checkout")));

            assertThat(source.readResource("values/dimens.xml")).isEqualTo(oddlyFormatted);
            assertThat(destination.hasResource("values/dimens.xml")).isFalse();
        }

        @Test
        void preservesEscapeSequences() throws IOException {
            source.resource("values/strings.xml", ModuleFixture.values(
                "<string name=\"keep\">Fish &amp; Chips</string>",
                "<string name=\"dont\">Don&apos;t&nbsp;stop&#8230;</string>"));

            editor.moveResources(source.root(), destination.root(), Set.of(string("dont")));

            assertThat(destination.readResource("values/strings.xml"))
                .contains("<string name=\"dont\">Don&apos;t&nbsp;stop&#8230;</string>");
            assertThat(source.readResource("values/strings.xml"))
                .contains("<string name=\"keep\">Fish &amp; Chips</string>");
        }

        @Test
        void matchesOnTypeAndName() throws IOException {
            source.resource("values/values.xml", ModuleFixture.values(
                "<string name=\"gap\">Gap</string>",
                "<item type=\"dimen\" name=\"gap\">4dp</item>"));

            int moved = editor.moveResources(source.root(), destination.root(),
                Set.of(new ResourceDependency(ResourceType.DIMEN, "gap")));

            assertThat(moved).isEqualTo(1);
            assertThat(destination.readResource("values/values.xml")).contains("<item type=\"dimen\" name=\"gap\">4dp</item>");
            assertThat(source.readResource("values/values.xml")).contains("<string name=\"gap\">Gap</string>");
        }

        @Test
        void matchesDottedStyleNames() throws IOException {
            source.resource("values/styles.xml", ModuleFixture.values(
                "<style name=\"Widget.Button\" parent=\"Base\"/>"));

            int moved = editor.moveResources(source.root(), destination.root(),
                Set.of(ResourceDependency.of(ResourceType.STYLE, "Widget.Button")));

            assertThat(moved).isEqualTo(1);
        }

        @Test
        void refusesToDuplicateExistingDefinition() throws IOException {
            source.resource("values/strings.xml", ModuleFixture.values("<string name=\"checkout\">Checkout</string>"));
            destination.resource("values/strings.xml", ModuleFixture.values("<string name=\"checkout\">Buy</string>"));

            int moved = editor.moveResources(source.root(), destination.root(), Set.of(string("checkout")));

            assertThat(moved).isZero();
            assertThat(source.readResource("values/strings.xml")).contains("Checkout");
            assertThat(destination.readResource("values/strings.xml")).doesNotContain("Checkout");
        }

        @Test
        void movesStandaloneFiles() throws IOException {
            source.resource("drawable-hdpi/ic_star.png", "png-bytes");
            source.resource("drawable/bg.xml", "<shape xmlns:android=\"http://schemas.android.com/apk/res/android\"/>");

            int moved = editor.moveResources(source.root(), destination.root(), Set.of(
                new ResourceDependency(ResourceType.DRAWABLE, "ic_star"),
                new ResourceDependency(ResourceType.DRAWABLE, "bg")));

            assertThat(moved).isEqualTo(2);
            assertThat(destination.readResource("drawable-hdpi/ic_star.png")).isEqualTo("png-bytes");
            assertThat(destination.hasResource("drawable/bg.xml")).isTrue();
            assertThat(source.hasResource("drawable-hdpi/ic_star.png")).isFalse();
            assertThat(source.hasResource("drawable/bg.xml")).isFalse();
        }

        @Test
        void refusesStandaloneMoveOntoExistingFile() throws IOException {
            source.resource("drawable/ic_star.png", "source");
            destination.resource("drawable/ic_star.png", "destination");

            int moved = editor.moveResources(source.root(), destination.root(),
                Set.of(new ResourceDependency(ResourceType.DRAWABLE, "ic_star")));

            assertThat(moved).isZero();
            assertThat(source.readResource("drawable/ic_star.png")).isEqualTo("source");
            assertThat(destination.readResource("drawable/ic_star.png")).isEqualTo("destination");
        }

        @Test
        void failsOnMalformedSource() {
            source.resource("values/strings.xml", "<resources><string name=\"a\">A</resources>");

            assertThatThrownBy(() -> editor.moveResources(source.root(), destination.root(), Set.of(string("a"))))
                .isInstanceOf(DocumentParseException.class);
        }
    }

    @Nested
    @DisplayName("Removing")
    class Removing {

        private final Set<ResourceType> allTypes = EnumSet.allOf(ResourceType.class);

        @Test
        void removesUnreferencedElements() throws IOException {
            source.resource("values/strings.xml", ModuleFixture.values(
                "<string name=\"title\">Title</string>",
                "<string name=\"unused_label\">Unused</string>"));

            int removed = editor.removeResources(source.root(), allTypes, Set.of(string("title")), null);

            assertThat(removed).isEqualTo(1);
            assertThat(source.readResource("values/strings.xml"))
                .isEqualTo(ModuleFixture.values("<string name=\"title\">Title</string>"));
        }

        @Test
        void respectsIgnorePattern() throws IOException {
            source.resource("values/strings.xml", ModuleFixture.values(
                "<string name=\"keep_me\">Keep</string>",
                "<string name=\"drop_me\">Drop</string>"));

            int removed = editor.removeResources(source.root(), allTypes, Set.of(), Pattern.compile("^keep_"));

            assertThat(removed).isEqualTo(1);
            assertThat(source.readResource("values/strings.xml")).contains("keep_me").doesNotContain("drop_me");
        }

        @Test
        void respectsTypeFilter() throws IOException {
            source.resource("values/values.xml", ModuleFixture.values(
                "<string name=\"a\">A</string>",
                "<color name=\"b\">#000</color>"));

            int removed = editor.removeResources(source.root(), EnumSet.of(ResourceType.COLOR), Set.of(), null);

            assertThat(removed).isEqualTo(1);
            assertThat(source.readResource("values/values.xml")).contains("<string name=\"a\">A</string>");
        }

        @Test
        void deletesStandaloneFilesAndEmptiedDocuments() throws IOException {
            source.resource("layout/unused_screen.xml", "<FrameLayout/>");
            source.resource("values/bools.xml", ModuleFixture.values("<bool name=\"flag\">true</bool>"));

            int removed = editor.removeResources(source.root(), allTypes, Set.of(), null);

            assertThat(removed).isEqualTo(2);
            assertThat(source.hasResource("layout/unused_screen.xml")).isFalse();
            assertThat(source.hasResource("values/bools.xml")).isFalse();
        }

        @Test
        void keepsDoctypeWhenRemoving() throws IOException {
            source.resource("values/strings.xml", """
                <?xml version="1.0" encoding="utf-8"?>
                <!DOCTYPE resources [
                    <!ENTITY app "Shop">
                ]>
                <resources>
                    <string name="title">&app;</string>
                    <string name="unused_label">Unused</string>
                </resources>
                """);

            int removed = editor.removeResources(source.root(), allTypes, Set.of(string("title")), null);

            assertThat(removed).isEqualTo(1);
            assertThat(source.readResource("values/strings.xml")).isEqualTo("""
                <?xml version="1.0" encoding="utf-8"?>
                <!DOCTYPE resources [
                    <!ENTITY app "Shop">
                ]>
                <resources>
                    <string name="title">&app;</string>
                </resources>
                """);
        }

        @Test
        void keepsByteOrderMarkWhenRemoving() throws IOException {
            source.resource("values/strings.xml", "\uFEFF" + ModuleFixture.values(
                "<string name=\"title\">Title</string>",
                "<string name=\"unused_label\">Unused</string>"));

            int removed = editor.removeResources(source.root(), allTypes, Set.of(string("title")), null);

            assertThat(removed).isEqualTo(1);
            assertThat(source.readResource("values/strings.xml"))
                .isEqualTo("\uFEFF" + ModuleFixture.values("<string name=\"title\">Title</string>"));
        }

        @Test
        void leavesUntouchedDoctypeAndByteOrderMarkFilesByteIdentical() throws IOException {
            String doctype = "<!DOCTYPE resources [<!ENTITY app \"Shop\">]>\n<resources><string name=\"a\">&app;</string></resources>\n";
            String bom = "\uFEFF<resources>\r\n  <color name=\"b\">#000</color>\r\n</resources>";
            source.resource("values/strings.xml", doctype);
            source.resource("values/colors.xml", bom);

            int removed = editor.removeResources(source.root(), allTypes,
                Set.of(string("a"), new ResourceDependency(ResourceType.COLOR, "b")), null);

            assertThat(removed).isZero();
            assertThat(source.readResource("values/strings.xml")).isEqualTo(doctype);
            assertThat(source.readResource("values/colors.xml")).isEqualTo(bom);
        }

        @Test
        void nothingToRemoveLeavesFilesUntouched() throws IOException {
            String strings = "<resources>  <string name=\"title\">Title</string></resources>";
            source.resource("values/strings.xml", strings);

            int removed = editor.removeResources(source.root(), allTypes, Set.of(string("title")), null);

            assertThat(removed).isZero();
            assertThat(source.readResource("values/strings.xml")).isEqualTo(strings);
        }
    }
}
