package org.clyze.source.callsite.ir;

import java.util.Objects;

/** Identifies a compiled method: class, name and (optionally) descriptor. */
public class UnitId {
    /** The binary class name, dotted ("a.b.C$1"). */
    public final String className;
    public final String methodName;
    /** The JVM descriptor, or null when only the name is known. */
    public final String descriptor;

    public UnitId(String className, String methodName, String descriptor) {
        this.className = className;
        this.methodName = methodName;
        this.descriptor = descriptor;
    }

    public UnitKind getKind() {
        return UnitKind.of(className, methodName);
    }

    public boolean matches(String otherClass, String otherMethod, String otherDescriptor) {
        return className.equals(otherClass) && methodName.equals(otherMethod) &&
                (descriptor == null || descriptor.equals(otherDescriptor));
    }

    @Override
    public boolean equals(Object object) {
        if (this == object)
            return true;
        if (!(object instanceof UnitId))
            return false;
        UnitId that = (UnitId) object;
        return className.equals(that.className) && methodName.equals(that.methodName) &&
                Objects.equals(descriptor, that.descriptor);
    }

    @Override
    public int hashCode() {
        return Objects.hash(className, methodName, descriptor);
    }

    @Override
    public String toString() {
        return className + "." + methodName + (descriptor == null ? "" : descriptor);
    }
}
