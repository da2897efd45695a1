// Copyright 2012 Benjamin Kalman
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//     http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package org.stencil.template.parser;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import org.junit.Test;
import org.stencil.template.ast.AstPrinter;
import org.stencil.template.ast.PartialStatement;
import org.stencil.template.ast.Program;

public class WhitespaceControlTest {

  @Test
  public void stripMarkersRemoveAllWhitespace() {
    assertEquals(
        "CONTENT[ '' ]\n" +
        "{{ PATH:foo [] }}\n" +
        "CONTENT[ '' ]\n",
        ast("  {{~foo~}}  "));
    assertEquals(
        "CONTENT[ ' a \n ' ]\n" +
        "{{ PATH:foo [] }}\n" +
        "CONTENT[ '' ]\n",
        ast(" a \n {{foo~}} \n\n"));
    assertEquals(
        "BLOCK:\n" +
        "  PATH:foo []\n" +
        "  PROGRAM:\n" +
        "    CONTENT[ 'a' ]\n",
        ast("{{#foo~}}  a  {{~/foo}}"));
  }

  @Test
  public void mustachesAreNeverStandalone() {
    assertEquals(
        "CONTENT[ 'a\n' ]\n" +
        "{{ PATH:foo [] }}\n" +
        "CONTENT[ '\nb' ]\n",
        ast("a\n{{foo}}\nb"));
  }

  @Test
  public void standaloneBlock() {
    assertEquals(
        "BLOCK:\n" +
        "  PATH:foo []\n" +
        "  PROGRAM:\n" +
        "    CONTENT[ 'bar\n' ]\n" +
        "CONTENT[ '' ]\n",
        ast("{{#foo}}\nbar\n{{/foo}}\n"));
  }

  @Test
  public void indentedStandaloneBlock() {
    assertEquals(
        "CONTENT[ '' ]\n" +
        "BLOCK:\n" +
        "  PATH:foo []\n" +
        "  PROGRAM:\n" +
        "    CONTENT[ '  bar\n' ]\n" +
        "CONTENT[ '' ]\n",
        ast("  {{#foo}}\n  bar\n  {{/foo}}\n"));
  }

  @Test
  public void standaloneElse() {
    assertEquals(
        "BLOCK:\n" +
        "  PATH:foo []\n" +
        "  PROGRAM:\n" +
        "    CONTENT[ 'a\n' ]\n" +
        "  {{^}}\n" +
        "    CONTENT[ 'b\n' ]\n",
        ast("{{#foo}}\na\n{{else}}\nb\n{{/foo}}"));
  }

  @Test
  public void elseChainStripMarkers() {
    assertEquals(
        "BLOCK:\n" +
        "  PATH:if [PATH:a]\n" +
        "  PROGRAM:\n" +
        "    CONTENT[ 'x' ]\n" +
        "  {{^}}\n" +
        "    BLOCK:\n" +
        "      PATH:if [PATH:b]\n" +
        "      PROGRAM:\n" +
        "        CONTENT[ 'y' ]\n",
        ast("{{#if a}}x {{~else if b~}} y{{/if}}"));
  }

  @Test
  public void standaloneComment() {
    assertEquals(
        "CONTENT[ 'a\n' ]\n" +
        "{{! ' x ' }}\n" +
        "CONTENT[ 'b' ]\n",
        ast("a\n{{! x }}\nb"));
  }

  @Test
  public void standalonePartialRemembersIndent() {
    Program program = Parser.parse("a\n  {{> p}}\nb");
    assertEquals(
        "CONTENT[ 'a\n' ]\n" +
        "{{> PARTIAL:p }}\n" +
        "CONTENT[ 'b' ]\n",
        new AstPrinter().print(program));
    assertEquals("  ", ((PartialStatement) program.body.get(1)).indent);

    program = Parser.parse("{{> p}}\n");
    assertEquals("", ((PartialStatement) program.body.get(0)).indent);

    program = Parser.parse("x {{> p}}\n");
    assertEquals("", ((PartialStatement) program.body.get(1)).indent);
  }

  @Test
  public void ignoreStandalone() {
    String source = "  {{#foo}}\n  bar\n  {{/foo}}\n";
    assertEquals(
        "CONTENT[ '  ' ]\n" +
        "BLOCK:\n" +
        "  PATH:foo []\n" +
        "  PROGRAM:\n" +
        "    CONTENT[ '\n  bar\n  ' ]\n" +
        "CONTENT[ '\n' ]\n",
        new AstPrinter().print(Parser.parse(source, true)));

    // Strip markers still apply.
    assertEquals(
        "CONTENT[ '' ]\n" +
        "{{ PATH:foo [] }}\n" +
        "CONTENT[ '' ]\n",
        new AstPrinter().print(Parser.parse("  {{~foo~}}  ", true)));
  }

  @Test
  public void processingTwiceChangesNothing() {
    Program program = Parser.parse("  {{#foo}}\n  bar\n  {{/foo}}\n");
    assertTrue(program.isWhitespaceProcessed());
    String once = new AstPrinter().print(program);
    assertSame(program, new WhitespaceControl().process(program));
    assertEquals(once, new AstPrinter().print(program));
  }

  private static String ast(String source) {
    return new AstPrinter().print(Parser.parse(source));
  }

}
