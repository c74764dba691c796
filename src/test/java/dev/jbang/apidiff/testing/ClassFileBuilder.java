package dev.jbang.apidiff.testing;

import static org.objectweb.asm.Opcodes.*;

import java.util.ArrayList;
import java.util.List;
import org.objectweb.asm.AnnotationVisitor;
import org.objectweb.asm.ClassWriter;
import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Type;

/** Writes small class files for tests, so no compiler is needed to produce fixtures */
public class ClassFileBuilder {
	private final String internalName;
	private int access = ACC_PUBLIC | ACC_SUPER;
	private String superName = "java/lang/Object";
	private final List<String> interfaces = new ArrayList<>();
	private String signature;
	private DeprecatedSpec deprecated;
	private final List<MethodSpec> methods = new ArrayList<>();
	private final List<String[]> recordComponents = new ArrayList<>();
	private final List<Object[]> innerClasses = new ArrayList<>();
	private String[] enclosingMethod;

	private record DeprecatedSpec(String since, boolean forRemoval, boolean attributeOnly) {}

	private record MethodSpec(int access, String name, String descriptor, String signature, DeprecatedSpec deprecated) {}

	private ClassFileBuilder(String internalName) {
		this.internalName = internalName;
	}

	/** A public class extending {@code java.lang.Object}, e.g. {@code com/example/Widget} */
	public static ClassFileBuilder publicClass(String internalName) {
		return new ClassFileBuilder(internalName);
	}

	public static ClassFileBuilder publicInterface(String internalName) {
		return new ClassFileBuilder(internalName).access(ACC_PUBLIC | ACC_INTERFACE | ACC_ABSTRACT);
	}

	public ClassFileBuilder access(int access) {
		this.access = access;
		return this;
	}

	public ClassFileBuilder extending(String superName) {
		this.superName = superName;
		return this;
	}

	public ClassFileBuilder implementing(String... interfaceNames) {
		interfaces.addAll(List.of(interfaceNames));
		return this;
	}

	public ClassFileBuilder signature(String signature) {
		this.signature = signature;
		return this;
	}

	/** Add {@code @Deprecated(since = since, forRemoval = forRemoval)}, since may be null */
	public ClassFileBuilder deprecated(String since, boolean forRemoval) {
		this.deprecated = new DeprecatedSpec(since, forRemoval, false);
		return this;
	}

	/** Mark deprecated through the class file attribute only, as javac does for {@code @deprecated} */
	public ClassFileBuilder deprecatedAttribute() {
		this.deprecated = new DeprecatedSpec(null, false, true);
		return this;
	}

	/** Add a public no-arg constructor */
	public ClassFileBuilder constructor() {
		return method(ACC_PUBLIC, "<init>", "()V");
	}

	public ClassFileBuilder method(int access, String name, String descriptor) {
		return method(access, name, descriptor, null);
	}

	public ClassFileBuilder method(int access, String name, String descriptor, String signature) {
		methods.add(new MethodSpec(access, name, descriptor, signature, null));
		return this;
	}

	public ClassFileBuilder deprecatedMethod(
			int access, String name, String descriptor, String since, boolean forRemoval) {
		methods.add(new MethodSpec(access, name, descriptor, null, new DeprecatedSpec(since, forRemoval, false)));
		return this;
	}

	/** Declare a record component; the caller still has to make the class a record */
	public ClassFileBuilder recordComponent(String name, String descriptor) {
		recordComponents.add(new String[] {name, descriptor});
		return this;
	}

	/** Record this class as a member class of {@code outerName} */
	public ClassFileBuilder nestedIn(String outerName, String simpleName, int innerAccess) {
		innerClasses.add(new Object[] {internalName, outerName, simpleName, innerAccess});
		return this;
	}

	/** Record a member class declared inside this class */
	public ClassFileBuilder declaresMember(String memberName, String simpleName, int innerAccess) {
		innerClasses.add(new Object[] {memberName, internalName, simpleName, innerAccess});
		return this;
	}

	/** Make this class an anonymous class declared in a method of {@code outerName} */
	public ClassFileBuilder anonymousIn(String outerName, String methodName, String methodDescriptor) {
		enclosingMethod = new String[] {outerName, methodName, methodDescriptor};
		innerClasses.add(new Object[] {internalName, null, null, 0});
		return this;
	}

	public byte[] build() {
		ClassWriter cw = new ClassWriter(ClassWriter.COMPUTE_MAXS);
		int classAccess = access;
		if (deprecated != null && deprecated.attributeOnly()) {
			classAccess |= ACC_DEPRECATED;
		}
		cw.visit(V17, classAccess, internalName, signature, superName, interfaces.toArray(new String[0]));
		if (enclosingMethod != null) {
			cw.visitOuterClass(enclosingMethod[0], enclosingMethod[1], enclosingMethod[2]);
		}
		if (deprecated != null && !deprecated.attributeOnly()) {
			writeDeprecated(cw.visitAnnotation("Ljava/lang/Deprecated;", true), deprecated);
		}
		for (String[] component : recordComponents) {
			cw.visitRecordComponent(component[0], component[1], null).visitEnd();
		}
		for (Object[] inner : innerClasses) {
			cw.visitInnerClass((String) inner[0], (String) inner[1], (String) inner[2], (Integer) inner[3]);
		}
		for (MethodSpec spec : methods) {
			MethodVisitor mv = cw.visitMethod(spec.access(), spec.name(), spec.descriptor(), spec.signature(), null);
			if (spec.deprecated() != null) {
				writeDeprecated(mv.visitAnnotation("Ljava/lang/Deprecated;", true), spec.deprecated());
			}
			if ((spec.access() & (ACC_ABSTRACT | ACC_NATIVE)) == 0) {
				writeBody(mv, spec);
			}
			mv.visitEnd();
		}
		cw.visitEnd();
		return cw.toByteArray();
	}

	private void writeBody(MethodVisitor mv, MethodSpec spec) {
		mv.visitCode();
		if ("<init>".equals(spec.name())) {
			mv.visitVarInsn(ALOAD, 0);
			mv.visitMethodInsn(INVOKESPECIAL, superName, "<init>", "()V", false);
			mv.visitInsn(RETURN);
		} else {
			Type returnType = Type.getReturnType(spec.descriptor());
			switch (returnType.getSort()) {
				case Type.VOID:
					mv.visitInsn(RETURN);
					break;
				case Type.LONG:
					mv.visitInsn(LCONST_0);
					mv.visitInsn(LRETURN);
					break;
				case Type.FLOAT:
					mv.visitInsn(FCONST_0);
					mv.visitInsn(FRETURN);
					break;
				case Type.DOUBLE:
					mv.visitInsn(DCONST_0);
					mv.visitInsn(DRETURN);
					break;
				case Type.OBJECT:
				case Type.ARRAY:
					mv.visitInsn(ACONST_NULL);
					mv.visitInsn(ARETURN);
					break;
				default:
					mv.visitInsn(ICONST_0);
					mv.visitInsn(IRETURN);
			}
		}
		mv.visitMaxs(0, 0);
	}

	private static void writeDeprecated(AnnotationVisitor av, DeprecatedSpec spec) {
		if (spec.since() != null) {
			av.visit("since", spec.since());
		}
		if (spec.forRemoval()) {
			av.visit("forRemoval", Boolean.TRUE);
		}
		av.visitEnd();
	}
}
