/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.lognog;

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.collect.ImmutableList;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import net.hydromatic.lognog.compile.CompiledQuery;
import net.hydromatic.lognog.eval.Prop;
import net.hydromatic.lognog.eval.Row;
import net.hydromatic.lognog.foreign.Backend;
import net.hydromatic.lognog.foreign.JdbcBackend;
import net.hydromatic.lognog.util.LogNogException;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Command-line runner.
 *
 * <p>Reads queries, one per line, from standard input, or a single query
 * from the command line. If a JDBC URL is given, executes each query and
 * prints its rows; otherwise prints the plan and SQL.
 *
 * <p>Arguments:
 *
 * <ul>
 *   <li>{@code --config=file}: properties file, read after
 *       {@code lognog.properties} on the class path;
 *   <li>{@code --url=jdbc:...}, {@code --driver=class},
 *       {@code --user=name}, {@code --password=secret}: connection;
 *   <li>{@code --earliest=-24h}, {@code --latest=now}: time range;
 *   <li>{@code --explain}: print the plan even if there is a connection;
 *   <li>{@code --name=value}: a property, such as {@code --dialect=sqlite};
 *   <li>anything else: the query.
 * </ul>
 */
public class Main {
  private final BufferedReader in;
  private final PrintWriter out;
  private final Map<Prop, Object> propMap;
  private final Map<String, String> options = new LinkedHashMap<>();
  private final @Nullable String query;
  private final @Nullable Backend backend;

  /**
   * Command-line entry point.
   *
   * @param args Command-line arguments
   */
  public static void main(String[] args) {
    final Main main =
        new Main(ImmutableList.copyOf(args),
            new InputStreamReader(System.in, UTF_8),
            new OutputStreamWriter(System.out, UTF_8), new LinkedHashMap<>(),
            null);
    try {
      main.run();
    } catch (Throwable e) {
      e.printStackTrace();
      System.exit(1);
    }
  }

  /**
   * Creates a Main.
   *
   * @param argList Command-line arguments
   * @param in Input, from which queries are read if there is no query
   *   argument
   * @param out Output
   * @param propMap Property map, populated from configuration and arguments
   * @param backend Backend, or null to create one from the "--url"
   *   argument
   */
  public Main(List<String> argList, Reader in, Writer out,
      Map<Prop, Object> propMap, @Nullable Backend backend) {
    this.in = new BufferedReader(in);
    this.out = new PrintWriter(out);
    this.propMap = propMap;

    loadResource(propMap, "/lognog.properties");
    final List<String> words = new ArrayList<>();
    final Properties properties = new Properties();
    for (String arg : argList) {
      if (arg.startsWith("--")) {
        final int eq = arg.indexOf('=');
        final String name = eq < 0 ? arg.substring(2) : arg.substring(2, eq);
        final String value = eq < 0 ? "true" : arg.substring(eq + 1);
        if (Prop.BY_NAME.containsKey(name)) {
          properties.setProperty(Prop.PREFIX + name, value);
        } else {
          options.put(name, value);
        }
      } else {
        words.add(arg);
      }
    }
    final String config = options.get("config");
    if (config != null) {
      loadFile(propMap, config);
    }
    // Arguments override files
    Prop.load(propMap, properties);
    this.query = words.isEmpty() ? null : String.join(" ", words);

    final String url = options.get("url");
    if (backend == null && url != null) {
      backend =
          JdbcBackend.of(url, options.get("driver"), options.get("user"),
              options.get("password"));
    }
    this.backend = backend;
  }

  private static void loadResource(Map<Prop, Object> propMap, String name) {
    try (InputStream stream = Main.class.getResourceAsStream(name)) {
      if (stream != null) {
        final Properties properties = new Properties();
        properties.load(new InputStreamReader(stream, UTF_8));
        Prop.load(propMap, properties);
      }
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  private static void loadFile(Map<Prop, Object> propMap, String fileName) {
    try (Reader reader = Files.newBufferedReader(Paths.get(fileName), UTF_8)) {
      final Properties properties = new Properties();
      properties.load(reader);
      Prop.load(propMap, properties);
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot read config " + fileName, e);
    }
  }

  /** Runs the queries, and returns the number that failed. */
  public int run() {
    final Backend backend = this.backend;
    final QueryEngine engine =
        QueryEngine.of(backend != null ? backend : (q, session) -> {
          throw new UnsupportedOperationException("no backend");
        }, propMap);
    final QueryOptions queryOptions =
        QueryOptions.DEFAULT.withEarliest(options.get("earliest"))
            .withLatest(options.get("latest"));
    final boolean explain =
        backend == null || Boolean.parseBoolean(options.get("explain"));
    int failures = 0;
    for (String q : queries()) {
      try {
        if (explain) {
          final CompiledQuery compiled = engine.compile(q, queryOptions);
          out.println(compiled.explain());
        } else {
          final QueryResult result = engine.execute(q, queryOptions);
          for (Row row : result.rows) {
            out.println(row.toMap());
          }
          out.println("(" + result.rows.size() + " rows"
              + (result.truncated ? ", truncated" : "") + ", "
              + result.executionTimeMs + " ms)");
        }
      } catch (RuntimeException e) {
        if (!(e instanceof LogNogException)) {
          throw e;
        }
        out.println(((LogNogException) e).describeTo(new StringBuilder()));
        ++failures;
      }
      out.flush();
    }
    out.flush();
    return failures;
  }

  private List<String> queries() {
    if (query != null) {
      return ImmutableList.of(query);
    }
    final List<String> list = new ArrayList<>();
    try {
      for (String line; (line = in.readLine()) != null; ) {
        if (!line.trim().isEmpty()) {
          list.add(line);
        }
      }
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    return list;
  }
}

// End Main.java
