/*
 * ShelfDB: Embedded Object Store for Java
 *
 * Copyright 2021 Ken Westlund
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.shelfdb.core;

import com.shelfdb.api.Database;
import com.shelfdb.api.impl.OpenRequestImpl;
import com.shelfdb.schedule.EventLoop;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class DatabaseManagerTest {

    @Test
    public void testDatabases() {
        DatabaseManager manager = new DatabaseManager();
        assertNull(manager.getDatabase("shop"));
        assertEquals(0, manager.getVersion("shop"));

        manager.putDatabase(new DatabaseDescriptor("shop", 3));
        assertEquals(3, manager.getVersion("shop"));

        manager.removeDatabase("shop");
        assertEquals(0, manager.getVersion("shop"));
    }

    @Test
    public void testConnections() throws Exception {
        DatabaseManager manager = new DatabaseManager();
        EventLoop loop = new EventLoop();
        OpenRequestImpl request = new OpenRequestImpl(manager, loop, "shop", 1L, false);
        loop.drain();
        Database db = request.getResult();

        assertEquals(1, manager.getConnections("shop").size());
        assertSame(db, manager.getConnections("shop").get(0));
        // snapshot
        manager.getConnections("shop").clear();
        assertEquals(1, manager.getConnections("shop").size());

        db.close();
        assertTrue(manager.getConnections("shop").isEmpty());
        assertEquals(1, manager.getVersion("shop"));

        manager.reset();
        assertEquals(0, manager.getVersion("shop"));
    }
}
