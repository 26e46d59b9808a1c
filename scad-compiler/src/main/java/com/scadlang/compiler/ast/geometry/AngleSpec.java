package com.scadlang.compiler.ast.geometry;

import java.util.Arrays;

/**
 * rotate 的角度参数：绕轴旋转的标量角度，或依次绕 x、y、z 旋转的角度向量
 */
public final class AngleSpec {
    private final double scalar;
    private final double[] vector;

    private AngleSpec(double scalar, double[] vector) {
        this.scalar = scalar;
        this.vector = vector;
    }

    public static AngleSpec ofScalar(double degrees) {
        return new AngleSpec(degrees, null);
    }

    public static AngleSpec ofVector(double x, double y, double z) {
        return new AngleSpec(0, new double[]{x, y, z});
    }

    public boolean isScalar() {
        return vector == null;
    }

    public double getScalar() {
        return scalar;
    }

    /** 标量角度时返回 null */
    public double[] getVector() {
        return vector == null ? null : vector.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AngleSpec)) return false;
        AngleSpec other = (AngleSpec) o;
        return Double.compare(scalar, other.scalar) == 0 && Arrays.equals(vector, other.vector);
    }

    @Override
    public int hashCode() {
        return Double.hashCode(scalar) * 31 + Arrays.hashCode(vector);
    }

    @Override
    public String toString() {
        return isScalar() ? String.valueOf(scalar) : Arrays.toString(vector);
    }
}
