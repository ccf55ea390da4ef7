/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.relsec.api;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

public class PermissionEntryTest {

    @Test
    public void testNamesAreCaseInsensitive() {
        PermissionEntry entry = PermissionEntry.allow("post-Edit");
        assertTrue(entry.appliesTo("post-edit"));
        assertTrue(entry.appliesTo("POST-EDIT"));
        assertFalse(entry.appliesTo("post-approve"));
    }

    @Test
    public void testEquality() {
        assertEquals(PermissionEntry.deny("edit"), PermissionEntry.of("EDIT", PermissionValue.DENY));
        assertEquals(PermissionEntry.deny("edit").hashCode(), PermissionEntry.deny("Edit").hashCode());
        assertNotEquals(PermissionEntry.deny("edit"), PermissionEntry.allow("edit"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEmptyName() {
        PermissionEntry.allow("");
    }

    @Test(expected = NullPointerException.class)
    public void testNullValue() {
        PermissionEntry.of("edit", null);
    }

    @Test
    public void testToString() {
        assertEquals("edit=ALLOW", PermissionEntry.allow("edit").toString());
    }
}
