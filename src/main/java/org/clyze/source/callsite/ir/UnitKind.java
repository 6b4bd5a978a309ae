package org.clyze.source.callsite.ir;

/** The shapes of compiled methods, used to match units structurally. */
public enum UnitKind {
    METHOD,
    CONSTRUCTOR,
    STATIC_INITIALIZER,
    LAMBDA,
    CLOSURE,
    ANONYMOUS_CLASS_METHOD;

    /**
     * Classify a compiled method.
     * @param className     the binary class name (dotted)
     * @param methodName    the JVM method name
     * @return              the kind of the method
     */
    public static UnitKind of(String className, String methodName) {
        if (methodName.startsWith("lambda$"))
            return LAMBDA;
        if ("doCall".equals(methodName) && className.contains("_closure"))
            return CLOSURE;
        if ("<clinit>".equals(methodName))
            return STATIC_INITIALIZER;
        if ("<init>".equals(methodName))
            return CONSTRUCTOR;
        int dollar = className.lastIndexOf('$');
        if (dollar >= 0 && dollar + 1 < className.length() && Character.isDigit(className.charAt(dollar + 1)))
            return ANONYMOUS_CLASS_METHOD;
        return METHOD;
    }
}
