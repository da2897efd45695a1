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

package org.stencil.template;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.json.JSONObject;
import org.junit.Test;
import org.stencil.json.JsonView;

public class HandlebarTest {

  public static class Person {
    public final String name;
    private final int age;

    public Person(String name, int age) {
      this.name = name;
      this.age = age;
    }

    public int getAge() {
      return age;
    }
  }

  @Test
  public void passThrough() {
    assertEquals("hello\n  world\n", render("hello\n  world\n", null));
    assertEquals("", render("", map("a", 1)));
    assertEquals("a } b }} c", render("a } b }} c", null));
  }

  @Test
  public void escaping() {
    Map<String, Object> data = map("foo", "bar<");
    assertEquals("bar&lt;", render("{{foo}}", data));
    assertEquals("bar<", render("{{{foo}}}", data));
    assertEquals("bar<", render("{{&foo}}", data));
    assertEquals("&amp;&lt;&gt;&quot;&#x27;&#x60;", render("{{a}}", map("a", "&<>\"'`")));
  }

  @Test
  public void noEscape() {
    Handlebar handlebar = new Handlebar("{{foo}}", new Handlebar.Config().noEscape(true));
    assertEquals("bar<", handlebar.render(map("foo", "bar<")));
  }

  @Test
  public void safeStringsAreNotEscaped() {
    Handlebar handlebar = new Handlebar("{{bold}} {{plain}}")
        .registerHelper("bold", new Helper() {
          @Override
          public Object apply(Options options) {
            return new SafeString("<b>x</b>");
          }
        })
        .registerHelper("plain", new Helper() {
          @Override
          public Object apply(Options options) {
            return "<b>x</b>";
          }
        });
    assertEquals("<b>x</b> &lt;b&gt;x&lt;/b&gt;", handlebar.render(null));
  }

  @Test
  public void escapedMustaches() {
    assertEquals("{{foo}} bar<", render("\\{{foo}} {{{foo}}}", map("foo", "bar<")));
    assertEquals("\\bar<", render("\\\\{{{foo}}}", map("foo", "bar<")));
  }

  @Test
  public void explicitStrip() {
    Map<String, Object> data = map("foo", "bar<");
    assertEquals("bar&lt;", render(" {{~foo~}} ", data));
    assertEquals("bar&lt; ", render(" {{~foo}} ", data));
    assertEquals(" bar&lt;", render(" {{foo~}} ", data));
    assertEquals("bar", render(
        " \n\n{{~#if foo~}} \n\nbar \n\n{{~/if~}}\n\n ", data));
  }

  @Test
  public void compatibilityExamples() {
    assertEquals("plain text\n", render("plain text\n", map()));

    Map<String, Object> foo = map("foo", "bar<");
    assertEquals("bar&lt;", render("{{foo}}", foo));
    assertEquals("bar<", render("{{{foo}}}", foo));
    assertEquals("bar<", render("{{&foo}}", foo));
    assertEquals("bar&lt;", render(" {{~foo~}} ", foo));
    assertEquals("bar&lt; ", render(" {{~foo}} ", foo));
    assertEquals(" bar&lt;", render(" {{foo~}} ", foo));
    assertEquals("bar", render(" \n\n{{~#if foo~}} \n\nbar \n\n{{~/if~}}\n\n ", foo));

    assertEquals("ab", render("{{#each list}}{{.}}{{/each}}",
        map("list", Arrays.asList("a", "b"))));
    assertEquals("inverse", render("{{#if 0}}body{{else}}inverse{{/if}}", map()));
    assertEquals("body", render("{{#if 0 includeZero=true}}body{{else}}inverse{{/if}}", map()));

    try {
      render("{{#foo}}{{/bar}}", map());
      fail();
    } catch (ParseException expected) {
    }

    assertEquals("X", render("{{#with a}}{{../root}}{{/with}}", map("a", map(), "root", "X")));
    assertEquals("X", render("{{#with a}}{{../root}}{{/with}}",
        new JSONObject("{\"a\":{},\"root\":\"X\"}")));

    try {
      render("{{> missing}}", map());
      fail();
    } catch (PartialException expected) {
    }
  }

  @Test
  public void standaloneLines() {
    assertEquals("a\nb\n", render("{{#if x}}\na\n{{/if}}\nb\n", map("x", true)));
    assertEquals("b\n", render("{{#if x}}\na\n{{/if}}\nb\n", map("x", false)));
    assertEquals("<ul>\n  <li>1</li>\n  <li>2</li>\n</ul>\n",
        render("<ul>\n  {{#each xs}}\n  <li>{{.}}</li>\n  {{/each}}\n</ul>\n",
            map("xs", Arrays.asList(1, 2))));
    assertEquals("x\n", render("{{! comment }}\nx\n", null));
  }

  @Test
  public void ignoreStandalone() {
    Handlebar handlebar = new Handlebar("{{#if x}}\na\n{{/if}}\n",
        new Handlebar.Config().ignoreStandalone(true));
    assertEquals("\na\n\n", handlebar.render(map("x", true)));
  }

  @Test
  public void paths() {
    Map<String, Object> data = map(
        "a", map("b", map("c", "abc")),
        "list", Arrays.asList("x", "y"),
        "foo bar", "spaced");
    assertEquals("abc abc abc", render("{{a.b.c}} {{a/b/c}} {{this.a.b.c}}", data));
    assertEquals("y 2", render("{{list.[1]}} {{list.length}}", data));
    assertEquals("spaced spaced", render("{{[foo bar]}} {{\"foo bar\"}}", data));
    assertEquals("[]", render("[{{a.missing.c}}]", data));
  }

  @Test
  public void pojos() {
    assertEquals("ann is 30", render("{{name}} is {{age}}", new Person("ann", 30)));
    assertEquals("ann", render("{{#person}}{{name}}{{/person}}",
        map("person", new Person("ann", 30))));
  }

  @Test
  public void jsonData() {
    JSONObject json = new JSONObject("{\"a\": {\"b\": [1, 2.5, null]}}");
    assertEquals("1 2.5 []", render("{{a.b.[0]}} {{a.b.[1]}} [{{a.b.[2]}}]", json));
  }

  @Test
  public void numbers() {
    assertEquals("2.5 3 -1", render("{{a}} {{b}} {{c}}", map("a", 2.50, "b", 3.0, "c", -1)));
  }

  @Test
  public void sections() {
    assertEquals("ab", render("{{#list}}{{.}}{{/list}}", map("list", Arrays.asList("a", "b"))));
    assertEquals("no", render("{{#list}}yes{{else}}no{{/list}}",
        map("list", Collections.emptyList())));
    assertEquals("no", render("{{^list}}no{{/list}}", map("list", Collections.emptyList())));
    assertEquals("1", render("{{#obj}}{{a}}{{/obj}}", map("obj", map("a", 1))));
    assertEquals("t", render("{{#flag}}{{name}}{{/flag}}", map("flag", true, "name", "t")));
    assertEquals("", render("{{#missing}}x{{/missing}}", null));
  }

  @Test
  public void parentContexts() {
    assertEquals("X", render("{{#with a}}{{../root}}{{/with}}", map("a", map(), "root", "X")));
    assertEquals("1-top 2-top ", render("{{#each xs}}{{.}}-{{../name}} {{/each}}",
        map("xs", Arrays.asList(1, 2), "name", "top")));
  }

  @Test
  public void dataVariables() {
    Map<String, Object> data = map("title", "T", "items", Arrays.asList("a", "b"));
    assertEquals("TT", render("{{#each items}}{{@root.title}}{{/each}}", data));

    Map<String, Object> nested = map("outer", Arrays.asList(
        map("inner", Arrays.asList(1, 2)),
        map("inner", Arrays.asList(3))));
    assertEquals("00 01 10 ",
        render("{{#each outer}}{{#each inner}}{{@../index}}{{@index}} {{/each}}{{/each}}",
            nested));
  }

  @Test
  public void initialDataFrame() {
    Handlebar handlebar = new Handlebar("{{@user}} {{@root.name}}");
    assertEquals("alan ann",
        handlebar.render(map("name", "ann"), DataFrame.of(map("user", "alan"))));
  }

  @Test
  public void blockParams() {
    Map<String, Object> data = map(
        "items", Arrays.asList(map("name", "a"), map("name", "b")),
        "xs", Arrays.asList(1, 2),
        "ys", Arrays.asList("p", "q"));
    assertEquals("0:a 1:b ",
        render("{{#each items as |item i|}}{{i}}:{{item.name}} {{/each}}", data));
    assertEquals("1p 1q 2p 2q ",
        render("{{#each xs as |x|}}{{#each ../ys as |y|}}{{x}}{{y}} {{/each}}{{/each}}", data));
    assertEquals("a", render("{{#with items.[0] as |first|}}{{first.name}}{{/with}}", data));
  }

  @Test
  public void subExpressions() {
    Handlebar handlebar = new Handlebar("{{dash 'abc' (concat 'a' 'b')}} {{concat (concat x y) z}}")
        .registerHelper("dash", new Helper() {
          @Override
          public Object apply(Options options) {
            return options.paramString(0) + "-" + options.paramString(1);
          }
        })
        .registerHelper("concat", CONCAT);
    assertEquals("abc-ab xyz", handlebar.render(map("x", "x", "y", "y", "z", "z")));
  }

  @Test
  public void helpersAndFields() {
    Handlebar handlebar = new Handlebar("{{name}} {{name 1}}")
        .registerHelper("name", new Helper() {
          @Override
          public Object apply(Options options) {
            return "helper";
          }
        });
    assertEquals("field helper", handlebar.render(map("name", "field")));
    assertEquals("helper helper", handlebar.render(map()));
  }

  @Test
  public void hashArguments() {
    Handlebar handlebar = new Handlebar("{{link \"home\" href=url class=\"nav\"}}")
        .registerHelper("link", new Helper() {
          @Override
          public Object apply(Options options) {
            return new SafeString("<a href=\"" + Values.toString(options.hashValue("href")) +
                "\" class=\"" + Values.toString(options.hashValue("class")) + "\">" +
                Values.escapeHtml(options.paramString(0)) + "</a>");
          }
        });
    assertEquals("<a href=\"/\" class=\"nav\">home</a>", handlebar.render(map("url", "/")));
  }

  @Test
  public void blockHelpers() {
    Handlebar handlebar = new Handlebar(
        "{{#twice}}<{{name}}>{{/twice}} {{#bold}}{{name}}{{/bold}} {{#maybe}}y{{else}}n{{/maybe}}")
        .registerHelper("twice", new Helper() {
          @Override
          public Object apply(Options options) {
            assertTrue(options.isBlock());
            return options.fn() + options.fn();
          }
        })
        .registerHelper("bold", new Helper() {
          @Override
          public Object apply(Options options) {
            return "<b>" + options.fn() + "</b>";
          }
        })
        .registerHelper("maybe", new Helper() {
          @Override
          public Object apply(Options options) {
            return options.inverse();
          }
        });
    assertEquals("<&lt;a&gt;><&lt;a&gt;> <b>&lt;a&gt;</b> n", handlebar.render(map("name", "<a>")));
  }

  @Test
  public void blockHelperWithNewContext() {
    Handlebar handlebar = new Handlebar("{{#inner}}{{name}}/{{../name}}{{/inner}} {{name}}")
        .registerHelper("inner", new Helper() {
          @Override
          public Object apply(Options options) {
            return options.fn(map("name", "in"));
          }
        });
    assertEquals("in/out out", handlebar.render(map("name", "out")));
  }

  @Test
  public void helperStateIsRestored() {
    Handlebar handlebar = new Handlebar(
        "{{leaky}}{{name}} {{#withData}}{{@greeting}}{{/withData}}[{{@greeting}}]")
        .registerHelper("leaky", new Helper() {
          @Override
          public Object apply(Options options) {
            options.push(map("name", "leaked"));
            return "";
          }
        })
        .registerHelper("withData", new Helper() {
          @Override
          public Object apply(Options options) {
            options.setData("greeting", "hi");
            assertEquals("hi", Values.toString(options.data("greeting")));
            return options.fn();
          }
        });
    assertEquals("root hi[]", handlebar.render(map("name", "root")));
  }

  @Test
  public void pushAndPop() {
    Handlebar handlebar = new Handlebar("{{swap}}")
        .registerHelper("swap", new Helper() {
          @Override
          public Object apply(Options options) {
            options.push(map("v", "pushed"));
            String pushed = Values.toString(options.context().get("v"));
            JsonView popped = options.pop();
            return pushed + " " + Values.toString(popped.get("v")) + " " +
                Values.toString(options.context().get("v"));
          }
        });
    assertEquals("pushed pushed root", handlebar.render(map("v", "root")));
  }

  @Test
  public void rawBlocks() {
    Handlebar handlebar = new Handlebar("{{{{raw}}}} {{x}} {{{{/raw}}}}")
        .registerHelper("raw", new Helper() {
          @Override
          public Object apply(Options options) {
            return options.fn();
          }
        });
    assertEquals(" {{x}} ", handlebar.render(map("x", "no")));
  }

  @Test
  public void partials() {
    Handlebar handlebar = new Handlebar(
        "{{> greet}}|{{> greet person}}|{{> greet name=\"hashed\"}}|{{> data x=1}}")
        .registerPartial("greet", "hi {{name}}")
        .registerPartial("data", "{{@x}}{{x}}");
    assertEquals("hi root|hi ann|hi hashed|11",
        handlebar.render(map("name", "root", "person", map("name", "ann"))));
  }

  @Test
  public void partialsSeeOuterContexts() {
    Handlebar handlebar = new Handlebar("{{#with person}}{{> p}}{{/with}}")
        .registerPartial("p", "{{name}} of {{../title}}");
    assertEquals("ann of T", handlebar.render(map("title", "T", "person", map("name", "ann"))));
  }

  @Test
  public void partialsDontSeeBlockParams() {
    Handlebar handlebar = new Handlebar("{{#each xs as |item|}}{{> p}}{{item}}{{/each}}")
        .registerPartial("p", "[{{item}}]");
    assertEquals("[]a[]b", handlebar.render(map("xs", Arrays.asList("a", "b"))));
  }

  @Test
  public void standalonePartialsAreIndented() {
    Handlebar handlebar = new Handlebar("<div>\n  {{> p}}\n</div>\n")
        .registerPartial("p", "a\nb\n");
    assertEquals("<div>\n  a\n  b\n</div>\n", handlebar.render(null));
  }

  @Test
  public void dynamicPartials() {
    Handlebar handlebar = new Handlebar("{{> (which)}} {{> (lookup . \"name\")}}")
        .registerHelper("which", new Helper() {
          @Override
          public Object apply(Options options) {
            return "p";
          }
        })
        .registerPartial("p", "P")
        .registerPartial("q", "Q");
    assertEquals("P Q", handlebar.render(map("name", "q")));
  }

  @Test
  public void missingPartial() {
    try {
      Handlebar.parse("x {{> missing}}").render(null);
      fail();
    } catch (PartialException expected) {
      assertEquals("The partial missing could not be found (line 1, column 3)",
          expected.getMessage());
    }
  }

  @Test
  public void partialRecursionIsBounded() {
    Handlebar handlebar = new Handlebar("{{> r}}", new Handlebar.Config().maxPartialDepth(3))
        .registerPartial("r", "r{{> r}}");
    try {
      handlebar.render(null);
      fail();
    } catch (PartialException expected) {
      assertTrue(expected.getMessage(),
          expected.getMessage().startsWith("Partial r nested more than 3 levels deep"));
    }
  }

  @Test
  public void recursivePartialsTerminateOnData() {
    Handlebar handlebar = new Handlebar("{{> node}}")
        .registerPartial("node", "{{name}}{{#each children}}({{> node}}){{/each}}");
    Map<String, Object> tree = map("name", "a", "children", Arrays.asList(
        map("name", "b", "children", Collections.emptyList()),
        map("name", "c", "children", Arrays.asList(map("name", "d")))));
    assertEquals("a(b)(c(d))", handlebar.render(tree));
  }

  @Test
  public void missingHelpers() {
    expectHelperException("{{foo bar}}", "Missing helper: \"foo\"");
    expectHelperException("{{#foo bar}}x{{/foo}}", "Missing helper: \"foo\"");
    expectHelperException("{{#if (foo)}}x{{/if}}", "Missing helper: \"foo\"");
  }

  @Test
  public void helperFailuresAreWrapped() {
    Handlebar handlebar = new Handlebar("{{bad}}")
        .registerHelper("bad", new Helper() {
          @Override
          public Object apply(Options options) {
            throw new IllegalStateException("boom");
          }
        });
    try {
      handlebar.render(null);
      fail();
    } catch (HelperException expected) {
      assertEquals("Helper \"bad\" failed: boom (line 1, column 1)", expected.getMessage());
      assertTrue(expected.getCause() instanceof IllegalStateException);
    }
  }

  @Test
  public void resolutionErrors() {
    try {
      render("{{#with a}}{{../../x}}{{/with}}", map("a", map("b", 1)));
      fail();
    } catch (ResolutionException expected) {
      assertNotNull(expected.getPosition());
    }
    try {
      render("{{../x}}", null);
      fail();
    } catch (ResolutionException expected) {}
  }

  @Test
  public void registration() {
    Handlebar handlebar = new Handlebar("").registerPartial("p", "x");
    try {
      handlebar.registerHelper("if", CONCAT);
      fail();
    } catch (RegistrationException expected) {
      assertEquals("Helper already registered: if", expected.getMessage());
    }
    try {
      handlebar.registerPartial("p", "y");
      fail();
    } catch (RegistrationException expected) {
      assertEquals("Partial already registered: p", expected.getMessage());
    }
    assertEquals("x", handlebar.render(handlebar.getPartial("p"), null, null));
  }

  @Test
  public void registeringMany() {
    Map<String, Helper> helpers = new LinkedHashMap<String, Helper>();
    helpers.put("concat", CONCAT);
    Map<String, String> partials = new LinkedHashMap<String, String>();
    partials.put("p", "{{concat a b}}");
    Handlebar handlebar = new Handlebar("{{> p}}").registerHelpers(helpers)
        .registerPartials(partials);
    assertEquals("ab", handlebar.render(map("a", "a", "b", "b")));
  }

  @Test
  public void invalidConfig() {
    try {
      new Handlebar.Config().maxPartialDepth(0);
      fail();
    } catch (IllegalArgumentException expected) {}
  }

  @Test
  public void printAst() {
    Handlebar handlebar = new Handlebar("a{{b}}");
    assertEquals("CONTENT[ 'a' ]\n{{ PATH:b [] }}\n", handlebar.printAst());
    assertEquals("a{{b}}", handlebar.toString());
  }

  @Test
  public void renderingIsRepeatable() {
    Handlebar handlebar = new Handlebar("{{#each xs}}{{.}}{{/each}}");
    assertEquals("12", handlebar.render(map("xs", Arrays.asList(1, 2))));
    assertEquals("3", handlebar.render(map("xs", Arrays.asList(3))));
  }

  private static final Helper CONCAT = new Helper() {
    @Override
    public Object apply(Options options) {
      StringBuilder buf = new StringBuilder();
      for (JsonView param : options.params())
        buf.append(Values.toString(param));
      return buf.toString();
    }
  };

  private static String render(String template, Object data) {
    return new Handlebar(template).render(data);
  }

  private static void expectHelperException(String template, String message) {
    try {
      render(template, map());
      fail();
    } catch (HelperException expected) {
      assertTrue(expected.getMessage(), expected.getMessage().startsWith(message));
    }
  }

  static Map<String, Object> map(Object... keyValues) {
    Map<String, Object> map = new LinkedHashMap<String, Object>();
    for (int i = 0; i < keyValues.length; i += 2)
      map.put((String) keyValues[i], keyValues[i + 1]);
    return map;
  }

}
