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

/**
 * This package is the public API for the ShelfDB object store.
 *
 * <H2>ShelfDB API Overview</H2>
 * <ul>
 *     <li>{@link com.shelfdb.api.ShelfDB} -- entry point; opens, upgrades and deletes named databases</li>
 *     <li>{@link com.shelfdb.api.Database} -- a connection; creates object stores during upgrades and gives you
 *     transactions</li>
 *     <li>{@link com.shelfdb.api.Transaction} -- an atomic batch of requests over a set of object stores</li>
 *     <li>{@link com.shelfdb.api.ObjectStore} -- put, add, get, count, delete and clear records; create
 *     indexes</li>
 *     <li>{@link com.shelfdb.api.Index} and {@link com.shelfdb.api.Cursor} -- keyed and range query access to
 *     the records of a store</li>
 *     <li>{@link com.shelfdb.api.KeyRange} -- intervals of keys used as queries</li>
 * </ul>
 *
 * <H3>Requests and events</H3>
 * <p>
 * Nothing happens immediately. Every data operation returns a {@link com.shelfdb.api.Request} that runs on a
 * later turn of the {@link com.shelfdb.schedule.Scheduler} the ShelfDB instance was built with, and reports its
 * outcome by dispatching events to listeners. With the default {@link com.shelfdb.schedule.EventLoop}, the
 * caller turns the loop:
 * <pre>
 *     EventLoop loop = new EventLoop();
 *     ShelfDB shelf = new ShelfDB(loop);
 *     OpenRequest open = shelf.open("shop", 1);
 *     open.addEventListener(Event.UPGRADE_NEEDED, e -&gt; {
 *         Database db = open.getResult();
 *         db.createObjectStore("products", "id", true);
 *     });
 *     open.addEventListener(Event.SUCCESS, e -&gt; {
 *         Database db = open.getResult();
 *         Transaction tx = db.transaction("products", TransactionMode.READWRITE);
 *         Map&lt;String, Object&gt; apple = new HashMap&lt;&gt;();
 *         apple.put("name", "apple");
 *         tx.objectStore("products").add(apple);
 *     });
 *     loop.drain();
 * </pre>
 *
 * <H3>Errors</H3>
 * <p>
 * Every failure is a {@link com.shelfdb.api.DatabaseException}, whose subclass and
 * {@link com.shelfdb.api.DatabaseException#getErrorName()} identify the kind of error. Misuse detected when an
 * operation is called is thrown to the caller; errors found when a request runs are reported through its
 * <code>error</code> event and {@link com.shelfdb.api.Request#getError()}.
 */
package com.shelfdb.api;
