/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Replica.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.replica.scene;

import com.hellblazer.replica.scene.msg.MalformedMessageException;
import com.hellblazer.replica.scene.msg.Topic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default diagnostics: every dropped message is logged at warn.
 *
 * @author hal.hildebrand
 */
public class LoggingApplyDiagnostics implements ApplyDiagnostics {
    private static final Logger log = LoggerFactory.getLogger(LoggingApplyDiagnostics.class);

    @Override
    public void onRejected(Topic<?> topic, Object message, MalformedMessageException cause) {
        log.warn("Dropped malformed message on {}: {} ({})", topic, message, cause.getMessage());
    }
}
