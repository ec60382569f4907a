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
package net.hydromatic.lazyconf.eval;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsSame.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.File;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

/** Tests for {@link Prop}. */
public class PropTest {
  @Test void testDefaults() {
    final Map<Prop, Object> map = new HashMap<>();
    assertThat(Prop.SHARE_NORMAL_FORM.booleanValue(map), is(true));
    assertThat(Prop.EXTENSION.stringValue(map), is(".ncl"));
    assertThat(Prop.DIRECTORY.fileValue(map), is(new File("")));
  }

  @Test void testLookup() {
    assertThat(Prop.lookup("shareNormalForm"),
        sameInstance(Prop.SHARE_NORMAL_FORM));
    assertThat(Prop.lookup("SHARE_NORMAL_FORM"),
        sameInstance(Prop.SHARE_NORMAL_FORM));
    assertThrows(RuntimeException.class, () -> Prop.lookup("noSuchProp"));
    assertThat(Prop.BY_CAMEL_NAME,
        hasToString("[DIRECTORY, EXTENSION, SHARE_NORMAL_FORM]"));
  }

  @Test void testSetLenient() {
    final Map<Prop, Object> map = new HashMap<>();
    Prop.SHARE_NORMAL_FORM.setLenient(map, "FALSE");
    assertThat(Prop.SHARE_NORMAL_FORM.booleanValue(map), is(false));
    Prop.DIRECTORY.setLenient(map, "/tmp/conf");
    assertThat(Prop.DIRECTORY.fileValue(map), is(new File("/tmp/conf")));
    Prop.EXTENSION.setLenient(map, ".cfg");
    assertThat(Prop.EXTENSION.stringValue(map), is(".cfg"));

    final RuntimeException e =
        assertThrows(RuntimeException.class,
            () -> Prop.SHARE_NORMAL_FORM.setLenient(map, "maybe"));
    assertThat(e.getMessage(), is("value must be one of: 'true', 'false'"));
  }

  @Test void testSet() {
    final Map<Prop, Object> map = new HashMap<>();
    final RuntimeException e =
        assertThrows(RuntimeException.class,
            () -> Prop.EXTENSION.set(map, 3));
    assertThat(e.getMessage(),
        is("value for property must have type class java.lang.String"));
    assertThrows(RuntimeException.class,
        () -> Prop.EXTENSION.set(map, null));
    assertThrows(IllegalArgumentException.class,
        () -> Prop.EXTENSION.booleanValue(map));

    Prop.EXTENSION.set(map, ".x");
    assertThat(Prop.EXTENSION.remove(map), is(".x"));
    assertThat(Prop.EXTENSION.get(map), is(".ncl"));
  }
}

// End PropTest.java
