package org.javai.mermaid.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ParserPolicyLoaderTest {

	private final ParserPolicyLoader loader = new ParserPolicyLoader();

	@Test
	void readsAllKeys() {
		ParserPolicy policy = loader.loadString("""
				parser:
				  references: WARN
				  extract-icons: false
				  front-matter: false
				""");

		assertThat(policy).isEqualTo(new ParserPolicy(ReferencePolicy.WARN, false, false));
	}

	@Test
	void missingKeysFallBackToDefaults() {
		assertThat(loader.loadString("parser:\n  references: warn\n")).isEqualTo(ParserPolicy.lenient());
		assertThat(loader.loadString("other: 1")).isEqualTo(ParserPolicy.defaults());
		assertThat(loader.loadString("")).isEqualTo(ParserPolicy.defaults());
	}

	@Test
	void rejectsUnknownReferencePolicy() {
		assertThatThrownBy(() -> loader.loadString("parser:\n  references: ignore\n"))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("ignore");
	}

	@Test
	void rejectsNonBooleanFlag() {
		assertThatThrownBy(() -> loader.loadString("parser:\n  extract-icons: sometimes\n"))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("extract-icons");
	}

	@Test
	void rejectsNonMappingDocument() {
		assertThatThrownBy(() -> loader.loadString("- a\n- b\n"))
				.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void loadsBundledResource() {
		assertThat(loader.loadDefault(getClass().getClassLoader())).isEqualTo(ParserPolicy.defaults());
	}

	@Test
	void loadsFromFile(@TempDir Path dir) throws IOException {
		Path file = dir.resolve("policy.yml");
		Files.writeString(file, "parser:\n  front-matter: false\n");

		assertThat(loader.load(file).frontMatter()).isFalse();
	}

	@Test
	void missingFileIsIllegalState(@TempDir Path dir) {
		assertThatThrownBy(() -> loader.load(dir.resolve("absent.yml")))
				.isInstanceOf(IllegalStateException.class);
	}
}
