package com.scadlang.compiler.visitor;

import com.scadlang.compiler.ast.AstNode;
import com.scadlang.compiler.ast.geometry.*;
import com.scadlang.compiler.ast.stmt.ModuleInstantiation;
import com.scadlang.compiler.diagnostic.ErrorCode;
import com.scadlang.compiler.parser.ParseResult;
import com.scadlang.compiler.parser.ScadParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * 内置模块特化与参数归一化测试
 */
class BuiltinModulesTest {

    private static AstNode first(String source) {
        ParseResult result = new ScadParser().parse(source);
        assertFalse(result.hasErrors(), () -> "unexpected diagnostics: " + result.getDiagnostics());
        return result.getAst().get(0);
    }

    @Nested
    @DisplayName("变换")
    class TransformTests {

        @Test
        @DisplayName("translate 补齐第三个分量")
        void testTranslate() {
            Translate translate = (Translate) first("translate([1, 2]) cube(1);");
            assertArrayEquals(new double[]{1, 2, 0}, translate.getV());
            assertEquals(1, translate.getChildren().size());
            assertTrue(translate.getChildren().get(0) instanceof Cube);
        }

        @Test
        @DisplayName("translate 实参不是常量时取默认值，原始实参保留")
        void testTranslateNonConstant() {
            Translate translate = (Translate) first("translate([a, 0, 0]) cube(1);");
            assertArrayEquals(new double[]{0, 0, 0}, translate.getV());
            assertEquals(1, translate.getArgs().size());
        }

        @Test
        @DisplayName("scale 标量扩展为向量")
        void testScale() {
            assertArrayEquals(new double[]{2, 2, 2}, ((Scale) first("scale(2) cube(1);")).getV());
            assertArrayEquals(new double[]{2, 3, 1}, ((Scale) first("scale([2, 3]) cube(1);")).getV());
        }

        @Test
        @DisplayName("mirror 默认法向量")
        void testMirror() {
            assertArrayEquals(new double[]{1, 0, 0}, ((Mirror) first("mirror() cube(1);")).getV());
            assertArrayEquals(new double[]{0, 1, 0}, ((Mirror) first("mirror([0, 1, 0]) cube(1);")).getV());
        }

        @Test
        @DisplayName("rotate 向量形式")
        void testRotateVector() {
            Rotate rotate = (Rotate) first("rotate([10, 20, 30]) cube(1);");
            assertFalse(rotate.getA().isScalar());
            assertArrayEquals(new double[]{10, 20, 30}, rotate.getA().getVector());
            assertNull(rotate.getV());
        }

        @Test
        @DisplayName("rotate 标量形式默认绕 z 轴")
        void testRotateScalar() {
            Rotate rotate = (Rotate) first("rotate(45) cube(1);");
            assertTrue(rotate.getA().isScalar());
            assertEquals(45.0, rotate.getA().getScalar());
            assertArrayEquals(new double[]{0, 0, 1}, rotate.getV());

            Rotate axis = (Rotate) first("rotate(a = 90, v = [1, 0, 0]) cube(1);");
            assertArrayEquals(new double[]{1, 0, 0}, axis.getV());
        }

        @Test
        @DisplayName("multmatrix 缺失元素取单位矩阵")
        void testMultmatrix() {
            Multmatrix multmatrix = (Multmatrix) first("multmatrix([[1, 0, 0, 5], [0, 1, 0, 6]]) cube(1);");
            double[][] m = multmatrix.getM();
            assertEquals(5.0, m[0][3]);
            assertEquals(6.0, m[1][3]);
            assertEquals(1.0, m[2][2]);
            assertEquals(1.0, m[3][3]);
        }

        @Test
        @DisplayName("color 名字、RGB 与透明度")
        void testColor() {
            Color named = (Color) first("color(\"red\") cube(1);");
            assertEquals("red", named.getColorName());
            assertNull(named.getRgba());

            Color rgb = (Color) first("color([1, 0, 0]) cube(1);");
            assertNull(rgb.getColorName());
            assertArrayEquals(new double[]{1, 0, 0, 1}, rgb.getRgba());

            Color alpha = (Color) first("color([0, 1, 0], 0.5) cube(1);");
            assertArrayEquals(new double[]{0, 1, 0, 0.5}, alpha.getRgba());
            assertEquals(0.5, alpha.getAlpha());
        }

        @Test
        @DisplayName("offset")
        void testOffset() {
            Offset offset = (Offset) first("offset(delta = 2, chamfer = true) square(1);");
            assertNull(offset.getR());
            assertEquals(2.0, offset.getDelta());
            assertTrue(offset.isChamfer());
            assertEquals(1.5, ((Offset) first("offset(r = 1.5) square(1);")).getR());
        }
    }

    @Nested
    @DisplayName("图元")
    class PrimitiveTests {

        @Test
        @DisplayName("cube 位置实参与具名实参等价")
        void testCube() {
            Cube positional = (Cube) first("cube(10, true);");
            Cube named = (Cube) first("cube(size = 10, center = true);");
            assertArrayEquals(new double[]{10, 10, 10}, positional.getSize());
            assertArrayEquals(positional.getSize(), named.getSize());
            assertTrue(positional.isCenter());
            assertTrue(named.isCenter());
        }

        @Test
        @DisplayName("cube 默认值")
        void testCubeDefaults() {
            Cube cube = (Cube) first("cube();");
            assertArrayEquals(new double[]{1, 1, 1}, cube.getSize());
            assertFalse(cube.isCenter());
        }

        @Test
        @DisplayName("square 二维尺寸")
        void testSquare() {
            assertArrayEquals(new double[]{3, 4}, ((Square) first("square([3, 4]);")).getSize());
        }

        @Test
        @DisplayName("sphere 与 circle 的直径")
        void testRadius() {
            assertEquals(2.0, ((Sphere) first("sphere(2);")).getRadius());
            assertEquals(3.0, ((Sphere) first("sphere(d = 6);")).getRadius());
            assertEquals(1.0, ((Circle) first("circle();")).getRadius());
        }

        @Test
        @DisplayName("cylinder 半径回退规则")
        void testCylinder() {
            Cylinder cylinder = (Cylinder) first("cylinder(h = 5, r = 2);");
            assertEquals(5.0, cylinder.getHeight());
            assertEquals(2.0, cylinder.getR1());
            assertEquals(2.0, cylinder.getR2());

            Cylinder cone = (Cylinder) first("cylinder(d = 4, r2 = 0);");
            assertEquals(1.0, cone.getHeight());
            assertEquals(2.0, cone.getR1());
            assertEquals(0.0, cone.getR2());
        }
    }

    @Nested
    @DisplayName("CSG 与通用实例化")
    class OtherTests {

        @Test
        @DisplayName("CSG 运算")
        void testCsg() {
            CsgOperation union = (CsgOperation) first("union() { cube(1); sphere(2); }");
            assertEquals(CsgOperator.UNION, union.getOperation());
            assertEquals(2, union.getChildren().size());
            assertEquals(CsgOperator.DIFFERENCE,
                    ((CsgOperation) first("difference() { cube(2); sphere(1); }")).getOperation());
        }

        @Test
        @DisplayName("用户模块保持通用实例化")
        void testUserModule() {
            ModuleInstantiation instantiation = (ModuleInstantiation) first("gear(teeth = 12);");
            assertEquals("gear", instantiation.getName());
            assertEquals(1, instantiation.getArgs().size());
        }

        @Test
        @DisplayName("修饰符")
        void testModifier() {
            assertEquals("#", ((Cube) first("#cube(1);")).getModifier());
            assertNull(((Cube) first("cube(1);")).getModifier());
        }

        @Test
        @DisplayName("重复实参给出警告")
        void testDuplicateArgument() {
            ParseResult result = new ScadParser().parse("cube(size = 1, size = 2);");
            assertFalse(result.hasErrors());
            assertEquals(ErrorCode.DUPLICATE_ARGUMENT, result.getDiagnostics().get(0).getCode());
            assertArrayEquals(new double[]{2, 2, 2}, ((Cube) result.getAst().get(0)).getSize());
        }

        @Test
        @DisplayName("用户模块的重复实参同样给出警告，实参原样保留")
        void testUserModuleDuplicateArgument() {
            ParseResult result = new ScadParser().parse("gear(teeth = 12, teeth = 14, 3);");
            assertFalse(result.hasErrors());
            assertEquals(1, result.getDiagnostics().size());
            assertEquals(ErrorCode.DUPLICATE_ARGUMENT, result.getDiagnostics().get(0).getCode());
            assertEquals(3, ((ModuleInstantiation) result.getAst().get(0)).getArgs().size());
        }
    }

    @Nested
    @DisplayName("签名表")
    class SignatureTests {

        @Test
        @DisplayName("签名文本与可接受类型")
        void testSignature() {
            BuiltinModules.Signature cube = BuiltinModules.getSignature("cube");
            assertEquals("cube(size, center)", cube.toDisplayString());
            assertThat(cube.getAcceptedTypes("size")).containsExactly("number", "vector");
            assertNull(cube.getAcceptedTypes("radius"));
            assertNotNull(cube.getDescription());
        }

        @Test
        @DisplayName("内置模块名")
        void testNames() {
            assertThat(BuiltinModules.getNames()).contains("translate", "cylinder", "union", "minkowski");
            assertNull(BuiltinModules.getSignature("gear"));
        }
    }
}
