/**
 * Dead-letter creation and operator actions (retry, acknowledge, purge, statistics).
 */
package com.ryuqq.railway.application.deadletter;
