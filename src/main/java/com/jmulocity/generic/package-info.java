/** Transport, error payload and pagination support shared by all platform APIs. */
package com.jmulocity.generic;
