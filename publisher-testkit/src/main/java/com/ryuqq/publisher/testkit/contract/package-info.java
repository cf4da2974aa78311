/**
 * Contract test infrastructure: manual clock, scripted adapters and a pipeline base class.
 *
 * @author Publisher Team
 * @since 1.0.0
 */
package com.ryuqq.publisher.testkit.contract;
