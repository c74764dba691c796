package dev.jbang.apidiff.inspect;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.objectweb.asm.AnnotationVisitor;
import org.objectweb.asm.ClassReader;
import org.objectweb.asm.ClassVisitor;
import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.RecordComponentVisitor;

/** Reads the structure of a class file without loading it. Method bodies are never visited. */
class ClassFileParser extends ClassVisitor {
	static final String DEPRECATED_DESCRIPTOR = "Ljava/lang/Deprecated;";

	private final MetadataContext owner;

	private String internalName;
	private int access;
	private String superName;
	private List<String> interfaces = List.of();
	private final DeprecationCollector deprecation = new DeprecationCollector();
	private final List<MethodCollector> methods = new ArrayList<>();
	private final List<String> recordComponents = new ArrayList<>();
	private String outerName;
	private String innerName;
	private int innerAccess;
	private boolean nested;
	private boolean localOrAnonymous;

	private ClassFileParser(MetadataContext owner) {
		super(Opcodes.ASM9);
		this.owner = owner;
	}

	/**
	 * Parse class bytes into a view owned by the given context.
	 *
	 * @throws IllegalArgumentException if the bytes are not a class file ASM can read
	 */
	static ClassView parse(byte[] bytes, MetadataContext owner) {
		if (bytes == null || bytes.length < 10 || readInt(bytes) != 0xCAFEBABE) {
			throw new IllegalArgumentException("Not a class file: bad magic number");
		}
		ClassFileParser parser = new ClassFileParser(owner);
		try {
			new ClassReader(bytes).accept(parser, ClassReader.SKIP_CODE | ClassReader.SKIP_FRAMES);
		} catch (IllegalArgumentException e) {
			throw e;
		} catch (RuntimeException e) {
			// Truncated or corrupt constant pools surface as index errors
			throw new IllegalArgumentException("Malformed class file: " + e, e);
		}
		if (parser.internalName == null) {
			throw new IllegalArgumentException("Class file declares no class");
		}
		return parser.build();
	}

	private static int readInt(byte[] bytes) {
		return ((bytes[0] & 0xFF) << 24) | ((bytes[1] & 0xFF) << 16) | ((bytes[2] & 0xFF) << 8) | (bytes[3] & 0xFF);
	}

	private ClassView build() {
		List<MethodView> methodViews = new ArrayList<>(methods.size());
		for (MethodCollector method : methods) {
			methodViews.add(method.toView());
		}
		return new ClassView(
				owner,
				internalName,
				access,
				superName,
				interfaces,
				deprecation.toDeprecation(access),
				methodViews,
				recordComponents,
				outerName,
				innerName,
				innerAccess,
				nested,
				localOrAnonymous);
	}

	@Override
	public void visit(int version, int access, String name, String signature, String superName, String[] interfaces) {
		this.internalName = name;
		this.access = access;
		this.superName = superName;
		this.interfaces = interfaces == null ? List.of() : Arrays.asList(interfaces);
	}

	@Override
	public void visitOuterClass(String owner, String name, String descriptor) {
		// Only local and anonymous classes carry an EnclosingMethod attribute
		localOrAnonymous = true;
	}

	@Override
	public void visitInnerClass(String name, String outerName, String innerName, int access) {
		if (!name.equals(internalName)) {
			return;
		}
		this.innerName = innerName;
		this.innerAccess = access;
		if (outerName == null || innerName == null) {
			localOrAnonymous = true;
		} else {
			this.outerName = outerName;
			this.nested = true;
		}
	}

	@Override
	public AnnotationVisitor visitAnnotation(String descriptor, boolean visible) {
		return deprecation.visitAnnotation(descriptor);
	}

	@Override
	public RecordComponentVisitor visitRecordComponent(String name, String descriptor, String signature) {
		recordComponents.add(name);
		return null;
	}

	@Override
	public MethodVisitor visitMethod(
			int access, String name, String descriptor, String signature, String[] exceptions) {
		MethodCollector method = new MethodCollector(access, name, descriptor, signature);
		methods.add(method);
		return method;
	}

	private static final class MethodCollector extends MethodVisitor {
		private final int access;
		private final String name;
		private final String descriptor;
		private final String signature;
		private final DeprecationCollector deprecation = new DeprecationCollector();

		MethodCollector(int access, String name, String descriptor, String signature) {
			super(Opcodes.ASM9);
			this.access = access;
			this.name = name;
			this.descriptor = descriptor;
			this.signature = signature;
		}

		@Override
		public AnnotationVisitor visitAnnotation(String descriptor, boolean visible) {
			return deprecation.visitAnnotation(descriptor);
		}

		MethodView toView() {
			return new MethodView(name, descriptor, signature, access, deprecation.toDeprecation(access));
		}
	}

	/** Collects {@code @Deprecated(since = ..., forRemoval = ...)} */
	private static final class DeprecationCollector {
		private boolean annotated;
		private String since;
		private boolean forRemoval;

		AnnotationVisitor visitAnnotation(String descriptor) {
			if (!DEPRECATED_DESCRIPTOR.equals(descriptor)) {
				return null;
			}
			annotated = true;
			return new AnnotationVisitor(Opcodes.ASM9) {
				@Override
				public void visit(String name, Object value) {
					if ("since".equals(name) && value instanceof String) {
						since = (String) value;
					} else if ("forRemoval".equals(name) && value instanceof Boolean) {
						forRemoval = (Boolean) value;
					}
				}
			};
		}

		Deprecation toDeprecation(int access) {
			boolean deprecated = annotated || (access & Opcodes.ACC_DEPRECATED) != 0;
			if (!deprecated) {
				return Deprecation.NONE;
			}
			return new Deprecation(true, since, forRemoval);
		}
	}
}
