package dev.jbang.apidiff.inspect;

import dev.jbang.apidiff.model.MethodSurface;
import dev.jbang.apidiff.model.TypeKind;
import dev.jbang.apidiff.model.TypeSurface;
import dev.jbang.apidiff.util.CancellationSignal;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.Type;
import org.objectweb.asm.signature.SignatureReader;
import org.objectweb.asm.util.TraceSignatureVisitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Flattens the visible types of an open metadata context into {@link TypeSurface} records. The
 * returned records hold no reference to the context and stay valid after it is closed.
 */
public class SurfaceExtractor {
	private static final Logger logger = LoggerFactory.getLogger(SurfaceExtractor.class);

	static final Set<String> ASYNC_TYPES = Set.of("java/util/concurrent/Future", "java/util/concurrent/CompletionStage");

	private static final String OBJECT = "java/lang/Object";

	/**
	 * Extract the surface of every observable type.
	 *
	 * @param context An open context
	 * @param includeNonPublic Also extract non-public types and members
	 * @return one surface per type, in module order, first definition wins
	 */
	public List<TypeSurface> extract(MetadataContext context, boolean includeNonPublic) {
		return extract(context, includeNonPublic, CancellationSignal.none());
	}

	/**
	 * Extract the surface of every observable type, checking for cancellation between types.
	 *
	 * @throws java.util.concurrent.CancellationException if the signal fires
	 */
	public List<TypeSurface> extract(MetadataContext context, boolean includeNonPublic, CancellationSignal signal) {
		Extraction extraction = new Extraction(context, includeNonPublic);
		Map<String, TypeSurface> surfaces = new LinkedHashMap<>();
		for (ClassView type : context.types()) {
			signal.throwIfCancelled();
			if (type.isSynthetic() || type.isLocalOrAnonymous()) {
				continue;
			}
			boolean observable = extraction.isObservable(type);
			if (!observable && !includeNonPublic) {
				continue;
			}
			TypeSurface surface = extraction.toSurface(type, observable);
			surfaces.putIfAbsent(surface.fullName(), surface);
		}
		return new ArrayList<>(surfaces.values());
	}

	/** Per-call state: visibility and assignability caches for one context */
	private static final class Extraction {
		private final MetadataContext context;
		private final boolean includeNonPublic;
		private final Map<String, Boolean> observable = new HashMap<>();
		private final Map<String, Boolean> async = new HashMap<>();

		Extraction(MetadataContext context, boolean includeNonPublic) {
			this.context = context;
			this.includeNonPublic = includeNonPublic;
		}

		boolean isObservable(ClassView type) {
			Boolean cached = observable.get(type.internalName());
			if (cached != null) {
				return cached;
			}
			boolean result;
			if (!type.isNested()) {
				result = (type.access() & Opcodes.ACC_PUBLIC) != 0;
			} else {
				boolean visibleItself = (type.innerAccess() & (Opcodes.ACC_PUBLIC | Opcodes.ACC_PROTECTED)) != 0;
				Optional<ClassView> outer = context.resolveLocal(type.outerName());
				result = visibleItself && outer.map(this::isObservable).orElse(true);
			}
			observable.put(type.internalName(), result);
			return result;
		}

		TypeSurface toSurface(ClassView type, boolean isPublic) {
			List<MethodSurface> methods = new ArrayList<>();
			Set<String> seen = new HashSet<>();
			for (MethodView method : type.methods()) {
				seen.add(method.overrideKey());
				if (method.isSpecial() || !isIncluded(method)) {
					continue;
				}
				toMethodSurface(type, method).ifPresent(methods::add);
			}
			for (MethodView method : inheritedMethods(type, seen)) {
				toMethodSurface(type, method).ifPresent(methods::add);
			}

			return new TypeSurface(
					type.binaryName(),
					type.packageName(),
					type.simpleName(),
					kindOf(type),
					isPublic,
					baseTypeOf(type),
					interfacesOf(type),
					type.deprecation().deprecated(),
					type.deprecation().message(),
					methods,
					propertiesOf(type, methods));
		}

		private boolean isIncluded(MethodView method) {
			return includeNonPublic || method.isPublic() || method.isProtected();
		}

		/**
		 * Instance methods inherited from supertypes inside the package's own modules that the type
		 * does not override. Walks superclasses first, then superinterfaces.
		 */
		private List<MethodView> inheritedMethods(ClassView type, Set<String> seen) {
			List<MethodView> inherited = new ArrayList<>();
			Deque<String> queue = new ArrayDeque<>();
			Set<String> visited = new HashSet<>();
			enqueueSupertypes(type, queue);
			while (!queue.isEmpty()) {
				String name = queue.poll();
				if (!visited.add(name)) {
					continue;
				}
				Optional<ClassView> supertype = context.resolveLocal(name);
				if (supertype.isEmpty()) {
					continue;
				}
				for (MethodView method : supertype.get().methods()) {
					if (method.isSpecial() || method.isStatic() || method.isPrivate() || !isIncluded(method)) {
						continue;
					}
					if (seen.add(method.overrideKey())) {
						inherited.add(method);
					}
				}
				enqueueSupertypes(supertype.get(), queue);
			}
			return inherited;
		}

		private static void enqueueSupertypes(ClassView type, Deque<String> queue) {
			if (type.superName() != null) {
				queue.add(type.superName());
			}
			queue.addAll(type.interfaces());
		}

		private Optional<MethodSurface> toMethodSurface(ClassView owner, MethodView method) {
			try {
				Type returnType = Type.getReturnType(method.descriptor());
				List<String> parameterTypes = new ArrayList<>();
				for (Type parameter : Type.getArgumentTypes(method.descriptor())) {
					parameterTypes.add(parameter.getClassName());
				}
				String renderedReturn = returnType.getClassName();
				if (method.signature() != null) {
					TraceSignatureVisitor trace = new TraceSignatureVisitor(method.access());
					new SignatureReader(method.signature()).accept(trace);
					renderedReturn = trace.getReturnType();
				}
				return Optional.of(new MethodSurface(
						method.name(),
						null,
						renderedReturn,
						parameterTypes,
						method.isStatic(),
						isAsyncShaped(returnType),
						method.deprecation().deprecated(),
						method.deprecation().message()));
			} catch (RuntimeException e) {
				logger.debug(
						"Skipping member {}.{}{}: {}",
						owner.binaryName(),
						method.name(),
						method.descriptor(),
						e.toString());
				return Optional.empty();
			}
		}

		private boolean isAsyncShaped(Type returnType) {
			if (returnType.getSort() != Type.OBJECT) {
				return false;
			}
			return isAssignableToAsync(returnType.getInternalName());
		}

		/** True when the type is, extends or implements one of the async types */
		boolean isAssignableToAsync(String internalName) {
			Boolean cached = async.get(internalName);
			if (cached != null) {
				return cached;
			}
			boolean result = false;
			Deque<String> queue = new ArrayDeque<>();
			Set<String> visited = new HashSet<>();
			queue.add(internalName);
			while (!queue.isEmpty() && !result) {
				String name = queue.poll();
				if (!visited.add(name)) {
					continue;
				}
				if (ASYNC_TYPES.contains(name)) {
					result = true;
				} else {
					context.resolve(name).ifPresent(view -> enqueueSupertypes(view, queue));
				}
			}
			async.put(internalName, result);
			return result;
		}

		private static TypeKind kindOf(ClassView type) {
			int access = type.access();
			if (type.isAnnotation()) {
				return TypeKind.ANNOTATION;
			}
			if (type.isInterface()) {
				return TypeKind.INTERFACE;
			}
			if (type.isEnum()) {
				return TypeKind.ENUM;
			}
			if (type.isRecord()) {
				return TypeKind.RECORD;
			}
			if ((access & Opcodes.ACC_ABSTRACT) != 0) {
				return TypeKind.ABSTRACT_CLASS;
			}
			if ((access & Opcodes.ACC_FINAL) != 0) {
				return TypeKind.FINAL_CLASS;
			}
			return TypeKind.CLASS;
		}

		private static String baseTypeOf(ClassView type) {
			if (type.isInterface() || type.superName() == null || OBJECT.equals(type.internalName())) {
				return null;
			}
			return type.superName().replace('/', '.');
		}

		/**
		 * All interfaces the type implements, directly or through its supertypes. An interface that
		 * cannot be resolved contributes its own name only.
		 */
		private Set<String> interfacesOf(ClassView type) {
			Set<String> result = new LinkedHashSet<>();
			Set<String> visitedClasses = new HashSet<>();
			Deque<String> interfaceQueue = new ArrayDeque<>(type.interfaces());
			String superName = type.superName();
			while (superName != null && visitedClasses.add(superName)) {
				Optional<ClassView> superType = context.resolve(superName);
				if (superType.isEmpty()) {
					break;
				}
				interfaceQueue.addAll(superType.get().interfaces());
				superName = superType.get().superName();
			}
			while (!interfaceQueue.isEmpty()) {
				String name = interfaceQueue.poll();
				if (!result.add(name.replace('/', '.'))) {
					continue;
				}
				context.resolve(name).ifPresent(view -> interfaceQueue.addAll(view.interfaces()));
			}
			return result;
		}

		/** Record components first, then JavaBeans names of the extracted instance methods */
		private static Set<String> propertiesOf(ClassView type, List<MethodSurface> methods) {
			Set<String> properties = new LinkedHashSet<>(type.recordComponents());
			for (MethodSurface method : methods) {
				if (method.isStatic()) {
					continue;
				}
				String property = propertyName(method);
				if (property != null) {
					properties.add(property);
				}
			}
			return properties;
		}
	}

	static String propertyName(MethodSurface method) {
		String name = method.name();
		int parameters = method.parameterTypes().size();
		String returnType = method.returnType();
		if (parameters == 0 && name.startsWith("get") && name.length() > 3 && !"void".equals(returnType)) {
			if ("getClass".equals(name)) {
				return null;
			}
			return decapitalize(name.substring(3));
		}
		if (parameters == 0 && name.startsWith("is") && name.length() > 2 && "boolean".equals(returnType)) {
			return decapitalize(name.substring(2));
		}
		if (parameters == 1 && name.startsWith("set") && name.length() > 3 && "void".equals(returnType)) {
			return decapitalize(name.substring(3));
		}
		return null;
	}

	/** JavaBeans rule: {@code URL} stays {@code URL}, {@code Color} becomes {@code color} */
	static String decapitalize(String name) {
		if (name.length() > 1 && Character.isUpperCase(name.charAt(1)) && Character.isUpperCase(name.charAt(0))) {
			return name;
		}
		if (!Character.isUpperCase(name.charAt(0))) {
			// getx() is not a JavaBeans accessor
			return null;
		}
		return Character.toLowerCase(name.charAt(0)) + name.substring(1);
	}
}
