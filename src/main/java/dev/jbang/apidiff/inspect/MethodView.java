package dev.jbang.apidiff.inspect;

import org.objectweb.asm.Opcodes;

/**
 * A method as declared in a class file. The descriptor and the generic signature are kept as raw
 * strings and parsed by the consumer, so a malformed one only affects this method.
 */
public record MethodView(String name, String descriptor, String signature, int access, Deprecation deprecation) {

	public boolean isStatic() {
		return (access & Opcodes.ACC_STATIC) != 0;
	}

	public boolean isPublic() {
		return (access & Opcodes.ACC_PUBLIC) != 0;
	}

	public boolean isProtected() {
		return (access & Opcodes.ACC_PROTECTED) != 0;
	}

	public boolean isPrivate() {
		return (access & Opcodes.ACC_PRIVATE) != 0;
	}

	/** Constructors, static initializers, bridges and compiler generated methods */
	public boolean isSpecial() {
		return name.startsWith("<") || (access & (Opcodes.ACC_SYNTHETIC | Opcodes.ACC_BRIDGE)) != 0;
	}

	/** Name plus parameter part of the descriptor, the key used for override matching */
	public String overrideKey() {
		int end = descriptor.indexOf(')');
		return name + (end < 0 ? descriptor : descriptor.substring(0, end + 1));
	}
}
