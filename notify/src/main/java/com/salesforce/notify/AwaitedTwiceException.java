/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.notify;

/**
 * Raised when a single-consumer future is polled again after it has already yielded its value. This is a misuse of
 * the API, typically two tasks awaiting the same waiter.
 */
public class AwaitedTwiceException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public AwaitedTwiceException(String message) {
        super(message);
    }
}
