/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.extractor.ast;

import com.powsybl.gridcomm.extractor.ast.Expression.*;
import com.powsybl.gridcomm.extractor.ast.Statement.*;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PythonParserTest {

    @Test
    void assignmentOfCall() {
        List<Statement> module = PythonParser.parse("nodes = ns.NodeContainer()\nnodes.Create(2)\n");
        assertEquals(2, module.size());
        Assignment assignment = assertInstanceOf(Assignment.class, module.get(0));
        assertEquals(List.of(new Name("nodes")), assignment.targets());
        Call constructor = assertInstanceOf(Call.class, assignment.value());
        assertEquals(new Attribute(new Name("ns"), "NodeContainer"), constructor.function());
        assertTrue(constructor.arguments().isEmpty());

        ExpressionStatement statement = assertInstanceOf(ExpressionStatement.class, module.get(1));
        Call create = assertInstanceOf(Call.class, statement.expression());
        assertEquals(List.of(new NumberLiteral(2L)), create.arguments());
        assertEquals(2, statement.line());
    }

    @Test
    void keywordArgumentsAndSlices() {
        List<Statement> module = PythonParser.parse("devices = csma.Install(nodes[1:3], name='lan')\n");
        Call install = assertInstanceOf(Call.class, ((Assignment) module.get(0)).value());
        Subscript subscript = assertInstanceOf(Subscript.class, install.arguments().get(0));
        Slice slice = assertInstanceOf(Slice.class, subscript.index());
        assertEquals(new NumberLiteral(1L), slice.lower());
        assertEquals(new NumberLiteral(3L), slice.upper());
        assertNull(slice.step());
        assertEquals(1, install.keywords().size());
        assertEquals("name", install.keywords().get(0).name());
        assertEquals(new StringLiteral("lan", false), install.keywords().get(0).value());
    }

    @Test
    void compoundStatements() {
        String source = String.join("\n",
                "from ns import ns",
                "import sys",
                "",
                "def main(argv):",
                "    for i in range(3):",
                "        if i > 1:",
                "            print(i)",
                "        else:",
                "            pass",
                "    return 0",
                "",
                "class Runner:",
                "    pass",
                "",
                "if __name__ == '__main__':",
                "    sys.exit(main(sys.argv))",
                "");
        List<Statement> module = PythonParser.parse(source);
        assertEquals(5, module.size());
        Import fromImport = assertInstanceOf(Import.class, module.get(0));
        assertEquals("ns", fromImport.module());
        assertEquals(List.of("ns"), fromImport.names());

        FunctionDefinition main = assertInstanceOf(FunctionDefinition.class, module.get(2));
        assertEquals("main", main.name());
        assertEquals(List.of("argv"), main.parameters());
        assertEquals(2, main.body().size());
        For loop = assertInstanceOf(For.class, main.body().get(0));
        assertEquals(new Name("i"), loop.target());
        If test = assertInstanceOf(If.class, loop.body().get(0));
        assertEquals(1, test.orElse().size());

        assertInstanceOf(ClassDefinition.class, module.get(3));
        assertInstanceOf(If.class, module.get(4));
    }

    @Test
    void tryAndWithBlocks() {
        String source = String.join("\n",
                "try:",
                "    import ns.core",
                "except ImportError as e:",
                "    raise SystemExit(1)",
                "finally:",
                "    x = [i * 2 for i in range(4) if i]",
                "with open('out.txt') as f:",
                "    f.write(\"done\")",
                "");
        List<Statement> module = PythonParser.parse(source);
        Try block = assertInstanceOf(Try.class, module.get(0));
        assertEquals(1, block.handlers().size());
        assertEquals("e", block.handlers().get(0).name());
        Assignment comprehension = assertInstanceOf(Assignment.class, block.finalBody().get(0));
        assertInstanceOf(Comprehension.class, comprehension.value());
        With with = assertInstanceOf(With.class, module.get(1));
        assertEquals(new Name("f"), with.items().get(0).target());
    }

    @Test
    void syntaxErrorsReportTheirLine() {
        ScriptSyntaxException e = assertThrows(ScriptSyntaxException.class, () -> PythonParser.parse("x = 1\nif x\n    y = 2\n"));
        assertEquals(2, e.getLine());
        assertTrue(e.getMessage().contains("line 2"));

        assertThrows(ScriptSyntaxException.class, () -> PythonParser.parse("  x = 1\n"));
        assertThrows(ScriptSyntaxException.class, () -> PythonParser.parse("def f(:\n    pass\n"));
        assertThrows(ScriptSyntaxException.class, () -> PythonParser.parse("x = = 2\n"));
    }
}
