/**
 * Inline background task server used by tests.
 */
package com.ryuqq.railway.adapter.inmemory.task;
