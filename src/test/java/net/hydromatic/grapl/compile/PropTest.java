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
package net.hydromatic.grapl.compile;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableMap;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;
import org.junit.jupiter.api.Test;

/** Tests for {@link Prop}. */
public class PropTest {
  @Test
  void testDefaults() {
    final Map<Prop, Object> map = ImmutableMap.of();
    assertThat(Prop.SHADOWING.booleanValue(map), is(false));
    assertThat(Prop.MAX_DEPTH.intValue(map), is(200));
    assertThat(Prop.MAX_CLIQUES.intValue(map), is(100_000));
    assertThat(Prop.MAX_NODES.intValue(map), is(10_000_000));
    assertThat(Prop.PARALLEL.booleanValue(map), is(false));
  }

  @Test
  void testLookup() {
    assertThat(Prop.lookup("maxDepth"), is(Prop.MAX_DEPTH));
    assertThat(Prop.lookup("MAX_DEPTH"), is(Prop.MAX_DEPTH));
    assertThat(Prop.BY_CAMEL_NAME.get(0), is(Prop.MAX_CLIQUES));
    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> Prop.lookup("maxWidth"));
    assertThat(e.getMessage(), is("property maxWidth not found"));
  }

  @Test
  void testSet() {
    final Map<Prop, Object> map = new HashMap<>();
    Prop.MAX_CLIQUES.set(map, 50);
    assertThat(Prop.MAX_CLIQUES.intValue(map), is(50));
    Prop.MAX_CLIQUES.set(map, null);
    assertThat(Prop.MAX_CLIQUES.intValue(map), is(100_000));

    assertThrows(IllegalArgumentException.class,
        () -> Prop.MAX_CLIQUES.set(map, "50"));
    assertThrows(IllegalArgumentException.class,
        () -> Prop.MAX_DEPTH.set(map, 0));
    assertThrows(IllegalArgumentException.class,
        () -> Prop.SHADOWING.intValue(map));
  }

  @Test
  void testSetLenient() {
    final Map<Prop, Object> map = new HashMap<>();
    Prop.SHADOWING.setLenient(map, " TRUE ");
    assertThat(Prop.SHADOWING.booleanValue(map), is(true));
    Prop.MAX_DEPTH.setLenient(map, "50");
    assertThat(Prop.MAX_DEPTH.intValue(map), is(50));
    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> Prop.PARALLEL.setLenient(map, "yes"));
    assertThat(e.getMessage(),
        is("value for property parallel must be true or false"));
    assertThrows(IllegalArgumentException.class,
        () -> Prop.MAX_DEPTH.setLenient(map, "deep"));
  }

  @Test
  void testParse() {
    final Properties properties = new Properties();
    properties.setProperty("shadowing", "true");
    properties.setProperty("MAX_CLIQUES", "10");
    final Map<Prop, Object> map = Prop.parse(properties);
    assertThat(map.size(), is(2));
    assertThat(Prop.SHADOWING.booleanValue(map), is(true));
    assertThat(Prop.MAX_CLIQUES.intValue(map), is(10));
  }
}

// End PropTest.java
