/** Four-step Secrets Manager rotation: create, set, test and finish. */
package com.example.lambdaharness.core.rotation;
