/*
 * Copyright 2026 Mark Andrew Ray-Smith
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
 * Demo applications for the locked file manager.
 * <p>
 * This package contains a walkthrough of the manager's operations and a
 * chaos run that hammers shared files from threads and processes.
 *
 * @see dev.mars.fspec.demo.LockDemo
 * @see dev.mars.fspec.demo.LockChaos
 */
package dev.mars.fspec.demo;
