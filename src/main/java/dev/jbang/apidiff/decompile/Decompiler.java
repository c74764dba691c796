package dev.jbang.apidiff.decompile;

import java.io.IOException;
import java.nio.file.Path;

/** Renders extracted class modules as readable text */
public interface Decompiler {

	/**
	 * @param moduleRoot directory holding the extracted class files of one package version
	 * @param typeFullName binary name of the type to render, or null to render every module
	 * @return the rendered text; a comment line when the requested type does not exist
	 * @throws IOException if the modules cannot be read
	 */
	String decompile(Path moduleRoot, String typeFullName) throws IOException;
}
