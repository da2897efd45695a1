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

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stencil.json.JsonViews;
import org.stencil.template.ast.AstPrinter;
import org.stencil.template.ast.Program;
import org.stencil.template.parser.Parser;

/**
 * A "handlebar" template; Handlebars/Mustache-compatible text with {{ }} expressions:
 *   * {{foo.bar}} and {{../foo}} look values up in the context stack, {{@index}} in private data.
 *   * {{{foo}}} and {{&foo}} output without HTML escaping.
 *   * {{#foo}}...{{else}}...{{/foo}} calls a block helper, or renders a section over foo.
 *   * {{> foo}} renders the partial registered as foo.
 *   * {{~foo~}} strips whitespace, and tags alone on their line take the line with them.
 *
 * The template is parsed when constructed. Helpers and partials are registered per template
 * (the built-in helpers if, unless, with, each, lookup and log come with every template) and a
 * name can only be registered once. Once registered, a template can render from many threads.
 */
public class Handlebar {

  private static final Logger LOG = LoggerFactory.getLogger(Handlebar.class);

  /**
   * Options for parsing and rendering a template, and its partials.
   */
  public static class Config {
    private boolean noEscape = false;
    private boolean ignoreStandalone = false;
    private int maxPartialDepth = 64;

    /** Don't HTML-escape the output of {{foo}}. */
    public Config noEscape(boolean noEscape) {
      this.noEscape = noEscape;
      return this;
    }

    /** Leave the whitespace around standalone tags in place. */
    public Config ignoreStandalone(boolean ignoreStandalone) {
      this.ignoreStandalone = ignoreStandalone;
      return this;
    }

    /** How deeply partials may include partials before rendering fails. */
    public Config maxPartialDepth(int maxPartialDepth) {
      if (maxPartialDepth < 1)
        throw new IllegalArgumentException("maxPartialDepth must be positive: " + maxPartialDepth);
      this.maxPartialDepth = maxPartialDepth;
      return this;
    }

    public boolean isNoEscape() {
      return noEscape;
    }

    public boolean isIgnoreStandalone() {
      return ignoreStandalone;
    }

    public int getMaxPartialDepth() {
      return maxPartialDepth;
    }
  }

  /** The source this was parsed from. */
  public final String source;

  private final Config config;
  private final Program program;
  private final ConcurrentMap<String, Helper> helpers = new ConcurrentHashMap<String, Helper>();
  private final ConcurrentMap<String, Program> partials = new ConcurrentHashMap<String, Program>();

  /** Creates a new {@link Handlebar} parsed from a string. */
  public Handlebar(String source) throws ParseException {
    this(source, new Config());
  }

  public Handlebar(String source, Config config) throws ParseException {
    this.source = source;
    this.config = config;
    this.program = Parser.parse(source, config.isIgnoreStandalone());
    helpers.putAll(Helpers.builtins());
  }

  /** Parses {@code source} with the default configuration. */
  public static Handlebar parse(String source) throws ParseException {
    return new Handlebar(source);
  }

  public Config getConfig() {
    return config;
  }

  public Program getProgram() {
    return program;
  }

  //
  // Registration.
  //

  /**
   * Registers a helper.
   *
   * @throws RegistrationException if a helper is already registered as {@code name}
   */
  public Handlebar registerHelper(String name, Helper helper) {
    if (helpers.putIfAbsent(name, helper) != null)
      throw new RegistrationException("Helper already registered: " + name);
    LOG.debug("Registered helper {}", name);
    return this;
  }

  public Handlebar registerHelpers(Map<String, ? extends Helper> helpers) {
    for (Map.Entry<String, ? extends Helper> entry : helpers.entrySet())
      registerHelper(entry.getKey(), entry.getValue());
    return this;
  }

  /**
   * Parses and registers a partial.
   *
   * @throws ParseException if {@code source} doesn't parse
   * @throws RegistrationException if a partial is already registered as {@code name}
   */
  public Handlebar registerPartial(String name, String source) {
    return registerPartial(name, Parser.parse(source, config.isIgnoreStandalone()));
  }

  /**
   * Registers an already-parsed partial.
   *
   * @throws RegistrationException if a partial is already registered as {@code name}
   */
  public Handlebar registerPartial(String name, Program partial) {
    if (partials.putIfAbsent(name, partial) != null)
      throw new RegistrationException("Partial already registered: " + name);
    LOG.debug("Registered partial {}", name);
    return this;
  }

  public Handlebar registerPartials(Map<String, String> sources) {
    for (Map.Entry<String, String> entry : sources.entrySet())
      registerPartial(entry.getKey(), entry.getValue());
    return this;
  }

  /** Returns null if there is no such helper. */
  public Helper getHelper(String name) {
    return helpers.get(name);
  }

  /** Returns null if there is no such partial. */
  public Program getPartial(String name) {
    return partials.get(name);
  }

  //
  // Rendering.
  //

  /**
   * Renders the template with {@code data} as the root context. Data can be a
   * {@link org.stencil.json.JsonView}, an org.json value, or any Java object.
   */
  public String render(Object data) throws RenderException {
    return render(data, null);
  }

  /**
   * Renders the template with {@code data} as the root context and {@code frame} as the initial
   * private data. @root is {@code data} unless the frame says otherwise.
   */
  public String render(Object data, DataFrame frame) throws RenderException {
    return render(program, data, frame);
  }

  /**
   * Renders any program, e.g. a partial, with this template's helpers, partials and configuration.
   */
  public String render(Program program, Object data, DataFrame frame) throws RenderException {
    return new Evaluator(this, JsonViews.of(data), frame).render(program);
  }

  /** The parsed template, as printed by {@link AstPrinter}. */
  public String printAst() {
    return new AstPrinter().print(program);
  }

  @Override
  public String toString() {
    return source;
  }

}
