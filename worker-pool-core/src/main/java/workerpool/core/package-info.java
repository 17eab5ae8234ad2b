/*
 * Copyright (c) 2024 VMware Inc. or its affiliates, All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

/**
 * A bounded pool of reusable worker threads.
 * <p>
 * {@link workerpool.core.WorkerPool} admits tasks onto at most {@code capacity} live
 * workers, hands new tasks to the oldest idle worker first, makes submitters wait when
 * saturated and retires workers that stayed idle longer than the survival time.
 * Instances are obtained from {@link workerpool.core.WorkerPools}.
 */
@NullMarked
package workerpool.core;

import org.jspecify.annotations.NullMarked;
