package dev.jbang.apidiff.decompile;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.objectweb.asm.ClassReader;
import org.objectweb.asm.util.Textifier;
import org.objectweb.asm.util.TraceClassVisitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Renders class files as ASM bytecode listings */
public class TextifierDecompiler implements Decompiler {
	private static final Logger logger = LoggerFactory.getLogger(TextifierDecompiler.class);

	// Dot separated Java identifiers, keeps lookups inside the module root
	private static final Pattern VALID_TYPE_NAME = Pattern.compile("[\\p{L}_$][\\p{L}\\p{N}_$]*(\\.[\\p{L}_$][\\p{L}\\p{N}_$]*)*");

	@Override
	public String decompile(Path moduleRoot, String typeFullName) throws IOException {
		if (typeFullName != null && !typeFullName.isBlank()) {
			Path classFile = findType(moduleRoot, typeFullName.trim());
			if (classFile == null) {
				return "// Type '" + typeFullName.trim() + "' not found\n";
			}
			return render(Files.readAllBytes(classFile));
		}

		List<Path> classFiles;
		try (Stream<Path> paths = Files.walk(moduleRoot)) {
			classFiles = paths.filter(p -> p.getFileName().toString().endsWith(".class"))
					.sorted()
					.collect(Collectors.toList());
		}
		StringBuilder sb = new StringBuilder();
		for (Path classFile : classFiles) {
			String moduleName = moduleRoot.relativize(classFile).toString().replace('\\', '/');
			sb.append("// ").append(moduleName).append('\n');
			try {
				sb.append(render(Files.readAllBytes(classFile)));
			} catch (IllegalArgumentException e) {
				logger.warn("Could not render {}: {}", moduleName, e.getMessage());
				sb.append("// Could not render module: ").append(e.getMessage()).append('\n');
			}
			sb.append('\n');
		}
		return sb.toString();
	}

	/**
	 * Locate the class file of a type given as binary name ({@code a.b.Outer$Inner}) or as canonical
	 * name ({@code a.b.Outer.Inner}).
	 */
	static Path findType(Path moduleRoot, String typeFullName) {
		if (!VALID_TYPE_NAME.matcher(typeFullName).matches()) {
			return null;
		}
		String internalName = typeFullName.replace('.', '/');
		while (true) {
			Path candidate = moduleRoot.resolve(internalName + ".class");
			if (Files.isRegularFile(candidate)) {
				return candidate;
			}
			int slash = internalName.lastIndexOf('/');
			if (slash < 0) {
				return null;
			}
			internalName = internalName.substring(0, slash) + "$" + internalName.substring(slash + 1);
		}
	}

	static String render(byte[] classBytes) {
		StringWriter out = new StringWriter();
		try (PrintWriter writer = new PrintWriter(out)) {
			ClassReader reader;
			try {
				reader = new ClassReader(classBytes);
				reader.accept(new TraceClassVisitor(null, new Textifier(), writer), 0);
			} catch (IllegalArgumentException e) {
				throw e;
			} catch (RuntimeException e) {
				throw new IllegalArgumentException("Malformed class file: " + e, e);
			}
		}
		return out.toString();
	}
}
