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

package workerpool.core.observability.micrometer;

import io.micrometer.common.docs.KeyName;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.docs.MeterDocumentation;

import workerpool.core.WorkerPool;

/**
 * Meters registered by {@link PoolMetrics} for each bound {@link WorkerPool}. All of them
 * carry the {@link PoolTags#POOL_NAME} tag.
 */
public enum PoolMeters implements MeterDocumentation {

	/**
	 * {@link Gauge} of the live workers of the pool, busy or idle ({@link WorkerPool#running()}).
	 */
	WORKERS_RUNNING {
		@Override
		public String getName() {
			return "workerpool.workers.running";
		}

		@Override
		public Meter.Type getType() {
			return Meter.Type.GAUGE;
		}
	},

	/**
	 * {@link Gauge} of the workers currently parked, waiting for a task ({@link WorkerPool#idle()}).
	 */
	WORKERS_IDLE {
		@Override
		public String getName() {
			return "workerpool.workers.idle";
		}

		@Override
		public Meter.Type getType() {
			return Meter.Type.GAUGE;
		}
	},

	/**
	 * {@link Gauge} of the maximum number of live workers, which can change through
	 * {@link WorkerPool#adjust(int)}.
	 */
	CAPACITY {
		@Override
		public String getName() {
			return "workerpool.capacity";
		}

		@Override
		public Meter.Type getType() {
			return Meter.Type.GAUGE;
		}
	},

	/**
	 * {@link Gauge} of the slots still available for new workers ({@link WorkerPool#free()}).
	 * Goes negative while the pool drains after its capacity was lowered.
	 */
	FREE {
		@Override
		public String getName() {
			return "workerpool.free";
		}

		@Override
		public Meter.Type getType() {
			return Meter.Type.GAUGE;
		}
	},

	/**
	 * {@link FunctionCounter} of the tasks that returned normally.
	 */
	TASKS_COMPLETED {
		@Override
		public String getName() {
			return "workerpool.tasks.completed";
		}

		@Override
		public Meter.Type getType() {
			return Meter.Type.COUNTER;
		}
	},

	/**
	 * {@link FunctionCounter} of the tasks that threw. Each failure also retires the worker
	 * that ran the task.
	 */
	TASKS_FAILED {
		@Override
		public String getName() {
			return "workerpool.tasks.failed";
		}

		@Override
		public Meter.Type getType() {
			return Meter.Type.COUNTER;
		}
	};

	@Override
	public KeyName[] getKeyNames() {
		return PoolTags.values();
	}

	/**
	 * Tags common to all the {@link PoolMeters}.
	 */
	public enum PoolTags implements KeyName {

		/**
		 * The {@link WorkerPool#name() name} of the pool.
		 */
		POOL_NAME {
			@Override
			public String asString() {
				return "workerpool.name";
			}
		}
	}
}
