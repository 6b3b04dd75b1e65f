/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.model;

public enum SuppressionState {
    active, suppressed
}
