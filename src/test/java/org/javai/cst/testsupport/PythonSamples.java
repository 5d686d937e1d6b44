package org.javai.cst.testsupport;

import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.params.provider.Arguments;

/**
 * Python sources that every parser backend must accept and reproduce exactly.
 * Each sample is named for the feature it exercises.
 */
public final class PythonSamples {

	private PythonSamples() {
	}

	public record Sample(String name, String source) {

		@Override
		public String toString() {
			return name;
		}
	}

	public static final List<Sample> MODULES = List.of(
			new Sample("empty", ""),
			new Sample("blank line", "\n"),
			new Sample("comment only", "# comment only\n"),
			new Sample("assignment", "x = 1\n"),
			new Sample("odd spacing", "x =  1+1\n"),
			new Sample("no trailing newline", "x = 1"),
			new Sample("comment without trailing newline", "x = 1\n# end"),
			new Sample("chained assignment", "a = b = c\n"),
			new Sample("annotated assignment", "x: int = 5\ny: List[int]\n"),
			new Sample("augmented assignment and semicolons", "x += 1; y -= 2;\n"),
			new Sample("del", "del a, b[0]\n"),
			new Sample("imports", "import os.path as p, sys\nfrom . import (a as b,\n    c,)\nfrom ..pkg.mod import *\n"),
			new Sample("function", "def f(a, b=2, *args, c, d=4, **kwargs) -> int:\n    return a\n"),
			new Sample("positional only", "def f(a, /, b):\n    pass\n"),
			new Sample("async", "async def g():\n    await x\n    async for i in y:\n        pass\n"
					+ "    async with a as b, c:\n        pass\n"),
			new Sample("decorated class", "@dec\n@dec2(1, k=2)\nclass C(Base, metaclass=M):\n    '''Doc.'''\n\n"
					+ "    def m(self):  # trailing\n        pass\n"),
			new Sample("if elif else", "if a:\n    pass\nelif b:\n    pass\nelse:\n    pass\n"),
			new Sample("while else", "while x < 10:\n    x += 1\nelse:\n    done()\n"),
			new Sample("for", "for i, j in pairs:\n    continue\n"),
			new Sample("try", "try:\n    risky()\nexcept (A, B) as e:\n    raise C from e\nexcept Exception:\n    raise\n"
					+ "else:\n    ok()\nfinally:\n    cleanup()\n"),
			new Sample("with", "with open(p) as f, lock:\n    data = f.read()\n"),
			new Sample("list comprehension", "result = [x * 2 for x in items if x > 0]\n"),
			new Sample("dicts and sets", "d = {k: v for k, v in pairs}\ns = {1, 2, *rest}\ne = {}\nm = {**a, 'b': 1}\n"),
			new Sample("generators and tuples", "g = (x for x in y)\nt = (1,)\nu = ()\nsum(x for x in y)\n"),
			new Sample("slices", "v = a[1:2, ::3, :]\n"),
			new Sample("lambda", "f = lambda x, *y, z=1: x if y else z\n"),
			new Sample("boolean and comparison", "ok = not a and b or c is not None and d not in e\n"),
			new Sample("arithmetic", "n = -x ** 2 + ~y // 3 @ z\n"),
			new Sample("strings", "s = 'a' 'b' \"c\"\nb = rb'x' + f'{y}'\n"),
			new Sample("yield", "def gen():\n    yield\n    yield 1, 2\n    x = yield from other()\n"),
			new Sample("global and nonlocal", "def f():\n    global a, b\n    nonlocal c\n    assert x, 'msg'\n"),
			new Sample("walrus", "if (n := 10) > 5:\n    print(n)\n"),
			new Sample("parenthesized lines", "x = (  # comment\n    1 +\n    2\n)\n"),
			new Sample("call over lines", "call(\n    a,\n    # note\n    b,\n)\n"),
			new Sample("backslash continuation", "x = 1 + \\\n    2\n"),
			new Sample("block footer", "if x:\n    pass\n    # footer comment\n# module comment\ny = 2\n"),
			new Sample("leading and trailing comments", "def f():\n\n    # leading\n    return 1\n\n\n# trailing\n"),
			new Sample("mixed indentation widths", "class C:\n  def f(self):\n      pass\n"),
			new Sample("tabs", "class C:\n\tdef f(self):\n\t\tpass\n"),
			new Sample("crlf", "x = 1\r\ny = 2\r\n"),
			new Sample("crlf block", "if x:\r\n    y = 1\r\n"),
			new Sample("coding comment", "# -*- coding: latin-1 -*-\nx = 1\n"),
			new Sample("whitespace footer", "x = 1   \n\n  \n"),
			new Sample("star arguments", "print(*args, **kwargs)\n"),
			new Sample("conditional expression", "x = a if b else c\n"),
			new Sample("list over lines", "x = [\n    1,\n    2,\n]\n"),
			new Sample("simple statement suites", "class E: pass\nif x: a = 1; b = 2\n"),
			new Sample("constants", "x = ...\ny = None\nz = True\n"),
			new Sample("numbers", "x = 0xFF + 1.5e3 + 2j\n"),
			new Sample("trailers", "a.b.c(d)[e].f\n"),
			new Sample("nested blocks", "def outer():\n    def inner():\n        return 1\n    return inner\n\n\nouter()\n"));

	public static Stream<Sample> modules() {
		return MODULES.stream();
	}

	public static Stream<Arguments> modulesWithNames() {
		return MODULES.stream().map(s -> Arguments.of(s.name(), s.source()));
	}
}
