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
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.stencil.template.HandlebarTest.map;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;

import org.junit.Test;

public class HelpersTest {

  @Test
  public void ifHelper() {
    assertEquals("yes", render("{{#if x}}yes{{else}}no{{/if}}", map("x", "a")));
    assertEquals("no", render("{{#if x}}yes{{else}}no{{/if}}", map("x", "")));
    assertEquals("no", render("{{#if x}}yes{{else}}no{{/if}}", map()));
    assertEquals("no", render("{{#if x}}yes{{else}}no{{/if}}",
        map("x", Collections.emptyList())));
    assertEquals("", render("{{#if x}}yes{{/if}}", map("x", false)));
  }

  @Test
  public void includeZero() {
    assertEquals("no", render("{{#if 0}}yes{{else}}no{{/if}}", null));
    assertEquals("yes", render("{{#if 0 includeZero=true}}yes{{else}}no{{/if}}", null));
    assertEquals("no", render("{{#if 0 includeZero=false}}yes{{else}}no{{/if}}", null));
    assertEquals("yes", render("{{#unless x includeZero=false}}yes{{/unless}}", map("x", 0)));
    assertEquals("", render("{{#unless x includeZero=true}}yes{{/unless}}", map("x", 0)));
  }

  @Test
  public void unlessHelper() {
    assertEquals("no", render("{{#unless x}}yes{{else}}no{{/unless}}", map("x", true)));
    assertEquals("yes", render("{{#unless x}}yes{{else}}no{{/unless}}", map("x", null)));
  }

  @Test
  public void elseChains() {
    String template = "{{#if a}}A{{else if b}}B{{else unless c}}C{{else}}D{{/if}}";
    assertEquals("A", render(template, map("a", true)));
    assertEquals("B", render(template, map("b", true)));
    assertEquals("C", render(template, map("c", false)));
    assertEquals("D", render(template, map("c", true)));
  }

  @Test
  public void conditionalsNeedOneArgument() {
    expectHelperException("{{#if}}x{{/if}}", "#if requires exactly one argument");
    expectHelperException("{{#unless a b}}x{{/unless}}", "#unless requires exactly one argument");
    expectHelperException("{{#with}}x{{/with}}", "#with requires exactly one argument");
  }

  @Test
  public void withHelper() {
    Map<String, Object> data = map("person", map("name", "ann"), "title", "T");
    assertEquals("ann T", render("{{#with person}}{{name}} {{../title}}{{/with}}", data));
    assertEquals("ann", render("{{#with person as |p|}}{{p.name}}{{/with}}", data));
    assertEquals("nobody", render("{{#with nobody}}x{{else}}nobody{{/with}}", data));
  }

  @Test
  public void withEmptyObjects() {
    assertEquals("in T", render("{{#with empty}}in {{../title}}{{else}}out{{/with}}",
        map("empty", map(), "title", "T")));
    assertEquals("out", render("{{#with empty}}in{{else}}out{{/with}}",
        map("empty", Collections.emptyList())));
    assertEquals("out", render("{{#with empty}}in{{else}}out{{/with}}", map("empty", "")));
    assertEquals("out", render("{{#with empty}}in{{else}}out{{/with}}", map("empty", false)));
  }

  @Test
  public void eachOverArrays() {
    assertEquals("ab", render("{{#each xs}}{{.}}{{/each}}", map("xs", Arrays.asList("a", "b"))));
    assertEquals("ab", render("{{#each xs}}{{this}}{{/each}}", map("xs", new String[] {"a", "b"})));
    assertEquals("0a,1b.",
        render("{{#each xs}}{{@index}}{{.}}{{#if @last}}.{{else}},{{/if}}{{/each}}",
            map("xs", Arrays.asList("a", "b"))));
    assertEquals("[a]b",
        render("{{#each xs}}{{#if @first}}[{{.}}]{{else}}{{.}}{{/if}}{{/each}}",
            map("xs", Arrays.asList("a", "b"))));
    assertEquals("0=a 1=b ",
        render("{{#each xs as |x i|}}{{i}}={{x}} {{/each}}", map("xs", Arrays.asList("a", "b"))));
    assertEquals("00 11 ",
        render("{{#each xs}}{{@key}}{{@index}} {{/each}}", map("xs", Arrays.asList("a", "b"))));
  }

  @Test
  public void eachOverObjects() {
    Map<String, Object> data = map("m", map("x", 1, "y", 2));
    assertEquals("x=1,y=2",
        render("{{#each m}}{{@key}}={{.}}{{#unless @last}},{{/unless}}{{/each}}", data));
    assertEquals("0x 1y ", render("{{#each m}}{{@index}}{{@key}} {{/each}}", data));
    assertEquals("x:1 y:2 ", render("{{#each m as |v k|}}{{k}}:{{v}} {{/each}}", data));
  }

  @Test
  public void eachElse() {
    assertEquals("none", render("{{#each xs}}x{{else}}none{{/each}}",
        map("xs", Collections.emptyList())));
    assertEquals("none", render("{{#each xs}}x{{else}}none{{/each}}", map("xs", map())));
    assertEquals("none", render("{{#each xs}}x{{else}}none{{/each}}", map()));
    assertEquals("", render("{{#each xs}}x{{/each}}", map("xs", "not iterable")));
  }

  @Test
  public void eachNeedsAnArgument() {
    expectHelperException("{{#each}}x{{/each}}", "Must pass iterator to #each");
  }

  @Test
  public void lookupHelper() {
    Map<String, Object> data = map(
        "ages", map("ann", 30, "bob", 40),
        "names", Arrays.asList("ann", "bob"),
        "key", "bob");
    assertEquals("40", render("{{lookup ages key}}", data));
    assertEquals("30 40 ", render("{{#each names}}{{lookup ../ages .}} {{/each}}", data));
    assertEquals("bob", render("{{lookup names 1}}", data));
    assertEquals("", render("{{lookup missing key}}", data));
    assertEquals("40", render("{{#with (lookup ages key)}}{{.}}{{/with}}", data));
  }

  @Test
  public void logHelper() {
    assertEquals("ab", render("a{{log \"hello\" x}}b", map("x", 1)));
    assertEquals("", render("{{log \"careful\" level=\"warn\"}}", null));
    assertEquals("", render("{{log \"bad\" level=\"error\"}}", null));
    assertEquals("", render("{{log \"quiet\" level=0}}", null));

    Handlebar handlebar = new Handlebar("{{log \"from data\"}}");
    assertEquals("", handlebar.render(null, DataFrame.of(map("level", "debug"))));
  }

  @Test
  public void builtinsAreRegisteredEverywhere() {
    Handlebar handlebar = new Handlebar("");
    for (String name : Helpers.builtins().keySet())
      assertTrue(name, handlebar.getHelper(name) != null);
    assertEquals(6, Helpers.builtins().size());
  }

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

}
