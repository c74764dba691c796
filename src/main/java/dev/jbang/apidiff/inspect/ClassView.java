package dev.jbang.apidiff.inspect;

import java.util.List;
import org.objectweb.asm.Opcodes;

/**
 * Structural view of one class file, bound to the metadata context it was read in. Every accessor
 * fails with {@link IllegalStateException} once that context has been closed.
 */
public final class ClassView {
	private final MetadataContext owner;
	private final String internalName;
	private final int access;
	private final String superName;
	private final List<String> interfaces;
	private final Deprecation deprecation;
	private final List<MethodView> methods;
	private final List<String> recordComponents;
	private final String outerName;
	private final String innerName;
	private final int innerAccess;
	private final boolean nested;
	private final boolean localOrAnonymous;

	ClassView(
			MetadataContext owner,
			String internalName,
			int access,
			String superName,
			List<String> interfaces,
			Deprecation deprecation,
			List<MethodView> methods,
			List<String> recordComponents,
			String outerName,
			String innerName,
			int innerAccess,
			boolean nested,
			boolean localOrAnonymous) {
		this.owner = owner;
		this.internalName = internalName;
		this.access = access;
		this.superName = superName;
		this.interfaces = List.copyOf(interfaces);
		this.deprecation = deprecation;
		this.methods = List.copyOf(methods);
		this.recordComponents = List.copyOf(recordComponents);
		this.outerName = outerName;
		this.innerName = innerName;
		this.innerAccess = innerAccess;
		this.nested = nested;
		this.localOrAnonymous = localOrAnonymous;
	}

	/** e.g. {@code com/example/Outer$Inner} */
	public String internalName() {
		owner.ensureOpen();
		return internalName;
	}

	/** Binary name with dots, e.g. {@code com.example.Outer$Inner} */
	public String binaryName() {
		owner.ensureOpen();
		return internalName.replace('/', '.');
	}

	public String packageName() {
		owner.ensureOpen();
		int slash = internalName.lastIndexOf('/');
		return slash < 0 ? "" : internalName.substring(0, slash).replace('/', '.');
	}

	public String simpleName() {
		owner.ensureOpen();
		if (innerName != null) {
			return innerName;
		}
		return internalName.substring(internalName.lastIndexOf('/') + 1);
	}

	public int access() {
		owner.ensureOpen();
		return access;
	}

	/** Super class internal name, null for {@code java/lang/Object} and module descriptors */
	public String superName() {
		owner.ensureOpen();
		return superName;
	}

	public List<String> interfaces() {
		owner.ensureOpen();
		return interfaces;
	}

	public Deprecation deprecation() {
		owner.ensureOpen();
		return deprecation;
	}

	public List<MethodView> methods() {
		owner.ensureOpen();
		return methods;
	}

	public List<String> recordComponents() {
		owner.ensureOpen();
		return recordComponents;
	}

	/** True for member classes, i.e. classes declared directly inside another class */
	public boolean isNested() {
		owner.ensureOpen();
		return nested;
	}

	/** Internal name of the enclosing class of a member class, null otherwise */
	public String outerName() {
		owner.ensureOpen();
		return outerName;
	}

	/** Access flags of a member class as declared in the source, taken from the InnerClasses attribute */
	public int innerAccess() {
		owner.ensureOpen();
		return innerAccess;
	}

	public boolean isLocalOrAnonymous() {
		owner.ensureOpen();
		return localOrAnonymous;
	}

	public boolean isInterface() {
		return (access() & Opcodes.ACC_INTERFACE) != 0;
	}

	public boolean isAnnotation() {
		return (access() & Opcodes.ACC_ANNOTATION) != 0;
	}

	public boolean isEnum() {
		return (access() & Opcodes.ACC_ENUM) != 0;
	}

	public boolean isRecord() {
		return "java/lang/Record".equals(superName()) && (access() & Opcodes.ACC_FINAL) != 0;
	}

	public boolean isSynthetic() {
		return (access() & Opcodes.ACC_SYNTHETIC) != 0;
	}

	@Override
	public String toString() {
		return "ClassView[" + internalName + "]";
	}
}
