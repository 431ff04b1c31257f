/*
 * Copyright 2020 Johan Haleby
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.tributary.listener.sample.billing;

import org.tributary.listener.EventListener;
import org.tributary.testsupport.billing.InvoiceIssued;

public class InvoiceListener implements EventListener {
    public int total;

    public void whenInvoiceIssued(InvoiceIssued event) {
        if (event.amount() < 0) {
            throw new IllegalArgumentException("Negative amount");
        }
        total += event.amount();
    }
}
